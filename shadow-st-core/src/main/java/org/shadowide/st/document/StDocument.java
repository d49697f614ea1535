package org.shadowide.st.document;

/**
 * Saved text of a document plus its unsaved working text. A document without working text is clean.
 */
public class StDocument {

    private final String id;
    private String savedText;
    private String workingText;

    public StDocument(String id, String savedText) {
        this.id = id;
        this.savedText = savedText == null ? "" : savedText;
    }

    public String getId() {
        return id;
    }

    public String getSavedText() {
        return savedText;
    }

    /**
     * {@code null} while the document is clean.
     */
    public String getWorkingText() {
        return workingText;
    }

    /**
     * Working text when present, otherwise the saved text.
     */
    public String getCurrentText() {
        return workingText != null ? workingText : savedText;
    }

    public boolean isDirty() {
        return workingText != null;
    }

    /**
     * Text equal to the saved text leaves the document clean.
     */
    void setWorkingText(String text) {
        this.workingText = text == null || text.equals(savedText) ? null : text;
    }

    void markSaved() {
        if (workingText != null) {
            savedText = workingText;
            workingText = null;
        }
    }

    @Override
    public String toString() {
        return "StDocument{" + id + (isDirty() ? ", dirty" : ", clean") + '}';
    }
}
