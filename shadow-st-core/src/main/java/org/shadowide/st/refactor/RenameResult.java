package org.shadowide.st.refactor;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a rename. {@code changes == 0} means nothing matched and {@link #getContent()} is the input text.
 */
public final class RenameResult {

    private final String content;
    private final int changes;
    private final List<Integer> affectedLines;

    public RenameResult(String content, int changes, List<Integer> affectedLines) {
        this.content = content;
        this.changes = changes;
        this.affectedLines = Collections.unmodifiableList(affectedLines);
    }

    public String getContent() {
        return content;
    }

    public int getChanges() {
        return changes;
    }

    /**
     * Sorted, distinct, 1-based.
     */
    public List<Integer> getAffectedLines() {
        return affectedLines;
    }

    public boolean isNoOp() {
        return changes == 0;
    }

    @Override
    public String toString() {
        return "RenameResult{changes=" + changes + ", affectedLines=" + affectedLines + '}';
    }
}
