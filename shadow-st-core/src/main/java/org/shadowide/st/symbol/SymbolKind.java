package org.shadowide.st.symbol;

public enum SymbolKind {
    PROGRAM("program"),
    FUNCTION("function"),
    FUNCTION_BLOCK("function_block"),
    VARIABLE("variable"),
    /** User defined {@code TYPE ... END_TYPE} structure. */
    UDT("udt");

    private final String id;

    SymbolKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean isRoutine() {
        return this == PROGRAM || this == FUNCTION || this == FUNCTION_BLOCK;
    }
}
