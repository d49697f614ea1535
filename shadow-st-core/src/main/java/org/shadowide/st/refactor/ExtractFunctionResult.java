package org.shadowide.st.refactor;

/**
 * Either the rewritten document or the reason no text was produced.
 */
public final class ExtractFunctionResult {

    private final RefactorError error;
    private final String message;
    private final String newContent;
    private final String extractedCode;
    private final String functionDeclaration;

    private ExtractFunctionResult(RefactorError error, String message, String newContent, String extractedCode,
                                  String functionDeclaration) {
        this.error = error;
        this.message = message;
        this.newContent = newContent;
        this.extractedCode = extractedCode;
        this.functionDeclaration = functionDeclaration;
    }

    public static ExtractFunctionResult success(String newContent, String extractedCode, String functionDeclaration) {
        return new ExtractFunctionResult(null, null, newContent, extractedCode, functionDeclaration);
    }

    public static ExtractFunctionResult failure(RefactorError error, String message) {
        return new ExtractFunctionResult(error, message, null, null, null);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public RefactorError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The whole document with the new routine appended; {@code null} on failure.
     */
    public String getNewContent() {
        return newContent;
    }

    public String getExtractedCode() {
        return extractedCode;
    }

    public String getFunctionDeclaration() {
        return functionDeclaration;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ExtractFunctionResult{success}" : "ExtractFunctionResult{" + error + ": " + message + '}';
    }
}
