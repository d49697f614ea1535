package org.shadowide.st.analysis;

/**
 * A finding on one line. Line is 1-based, column 0-based.
 */
public final class StDiagnostic {

    private final String id;
    private final int line;
    private final int column;
    private final int length;
    private final DiagnosticSeverity severity;
    private final DiagnosticCategory category;
    private final String message;
    private final String suggestion;

    public StDiagnostic(String id, int line, int column, int length, DiagnosticSeverity severity,
                        DiagnosticCategory category, String message, String suggestion) {
        this.id = id;
        this.line = line;
        this.column = column;
        this.length = length;
        this.severity = severity;
        this.category = category;
        this.message = message;
        this.suggestion = suggestion;
    }

    public String getId() {
        return id;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Characters covered from {@link #getColumn()}; 0 means to the end of the line.
     */
    public int getLength() {
        return length;
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public DiagnosticCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    /**
     * May be {@code null}.
     */
    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return severity + " " + line + ":" + column + " [" + category.getId() + "] " + message;
    }
}
