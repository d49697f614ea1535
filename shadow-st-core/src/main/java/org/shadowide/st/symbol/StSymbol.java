package org.shadowide.st.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry of the symbol table. Routines and structures are top level and own their declared variables as children.
 * Instances are rebuilt on every extraction.
 */
public class StSymbol {

    private final String name;
    private final SymbolKind kind;
    private final String dataType;
    private final int declarationLine;
    private final int column;
    private final String scope;
    private String initialValue;
    private String description;
    private String section;
    private int endLine;
    private List<StReference> references = Collections.emptyList();
    private final List<StSymbol> children = new ArrayList<>();

    public StSymbol(String name, SymbolKind kind, String dataType, int declarationLine, int column, String scope) {
        this.name = name;
        this.kind = kind;
        this.dataType = dataType;
        this.declarationLine = declarationLine;
        this.column = column;
        this.scope = scope;
        this.endLine = declarationLine;
    }

    static StSymbol variable(VarDeclaration declaration, String scope) {
        StSymbol symbol = new StSymbol(declaration.getName(), SymbolKind.VARIABLE, declaration.getDataType(),
                declaration.getLine(), declaration.getColumn(), scope);
        symbol.initialValue = declaration.getInitialValue();
        symbol.description = declaration.getDescription();
        symbol.section = declaration.getSection();
        return symbol;
    }

    public String getName() {
        return name;
    }

    public SymbolKind getKind() {
        return kind;
    }

    /**
     * Declared type of a variable, return type of a function, otherwise {@code null}.
     */
    public String getDataType() {
        return dataType;
    }

    /**
     * 1-based.
     */
    public int getDeclarationLine() {
        return declarationLine;
    }

    /**
     * 1-based line of the closing keyword for routines and structures; the declaration line for variables.
     */
    public int getEndLine() {
        return endLine;
    }

    void setEndLine(int endLine) {
        this.endLine = endLine;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Name of the enclosing routine or structure, or {@code "global"}.
     */
    public String getScope() {
        return scope;
    }

    public String getInitialValue() {
        return initialValue;
    }

    public String getDescription() {
        return description;
    }

    public String getSection() {
        return section;
    }

    public int getReferenceCount() {
        return references.size();
    }

    /**
     * Identifier occurrences outside the declaration line, in document order.
     */
    public List<StReference> getReferences() {
        return references;
    }

    void setReferences(List<StReference> references) {
        this.references = Collections.unmodifiableList(references);
    }

    public List<StSymbol> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(StSymbol child) {
        children.add(child);
    }

    /**
     * Routines always count as used; everything else needs at least one reference.
     */
    public boolean isUsed() {
        return kind.isRoutine() || getReferenceCount() > 0;
    }

    @Override
    public String toString() {
        return kind.getId() + " " + name + (dataType == null ? "" : " : " + dataType) + " @" + declarationLine;
    }
}
