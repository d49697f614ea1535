package org.shadowide.st.analysis;

public enum DiagnosticCategory {
    RESOURCE("resource"),
    UNSAFE_IO("unsafe_io"),
    PERFORMANCE("performance"),
    VALIDATION("validation");

    private final String id;

    DiagnosticCategory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
