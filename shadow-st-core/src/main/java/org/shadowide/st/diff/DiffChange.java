package org.shadowide.st.diff;

/**
 * Classification of one line index. Line numbers are 1-based and absent ({@code null}) on the side the line does
 * not exist on. The id is only unique within one diff run.
 */
public final class DiffChange {

    private final String changeId;
    private final ChangeType type;
    private final Integer originalLine;
    private final Integer modifiedLine;
    private final String originalText;
    private final String modifiedText;

    public DiffChange(String changeId, ChangeType type, Integer originalLine, Integer modifiedLine,
                      String originalText, String modifiedText) {
        this.changeId = changeId;
        this.type = type;
        this.originalLine = originalLine;
        this.modifiedLine = modifiedLine;
        this.originalText = originalText;
        this.modifiedText = modifiedText;
    }

    public String getChangeId() {
        return changeId;
    }

    public ChangeType getType() {
        return type;
    }

    public Integer getOriginalLine() {
        return originalLine;
    }

    public Integer getModifiedLine() {
        return modifiedLine;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getModifiedText() {
        return modifiedText;
    }

    public boolean isChange() {
        return type != ChangeType.UNCHANGED;
    }

    @Override
    public String toString() {
        return changeId + " " + type.getId() + " " + originalLine + "->" + modifiedLine;
    }
}
