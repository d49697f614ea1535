package org.shadowide.st.refactor;

/**
 * Input validation failures reported by the refactor engines.
 */
public enum RefactorError {
    /** Line range is empty, reversed or outside the document. */
    INVALID_SELECTION("Start line must be before end line and within the document"),
    /** Routine name or return type is not a usable identifier. */
    INVALID_IDENTIFIER("Name must start with a letter or underscore and contain only letters, digits and underscores");

    private final String defaultMessage;

    RefactorError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
