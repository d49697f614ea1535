package org.shadowide.st.symbol;

/**
 * One {@code name : type [:= initial];} line from a declaration block.
 */
public final class VarDeclaration {

    private final String name;
    private final String dataType;
    private final String initialValue;
    private final String description;
    private final String section;
    private final int line;
    private final int column;

    public VarDeclaration(String name, String dataType, String initialValue, String description, String section,
                          int line, int column) {
        this.name = name;
        this.dataType = dataType;
        this.initialValue = initialValue;
        this.description = description;
        this.section = section;
        this.line = line;
        this.column = column;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    /**
     * Text after {@code :=}, trimmed, or {@code null}.
     */
    public String getInitialValue() {
        return initialValue;
    }

    /**
     * Text of the first inline {@code (* ... *)} comment, or {@code null}.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Opening keyword of the enclosing block, e.g. {@code VAR_INPUT}, upper-cased.
     */
    public String getSection() {
        return section;
    }

    /**
     * 1-based.
     */
    public int getLine() {
        return line;
    }

    /**
     * 0-based offset of the name in the raw line.
     */
    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return name + " : " + dataType + " @" + line;
    }
}
