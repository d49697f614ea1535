package org.shadowide.st.lsp;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Commands handled by {@code workspace/executeCommand}. Line arguments are 1-based.
 */
public final class StCommands {

    /** {@code [uri, query?]}: declared tags, optionally filtered by a regex or literal query. */
    public static final String ANALYZE_TAGS = "st.analyzeTags";

    /** {@code [uri, startLine, endLine, name, returnType?]} */
    public static final String EXTRACT_FUNCTION = "st.extractFunction";

    /** {@code [uri, oldNameOrPattern, newName, "literal" | "pattern"]} */
    public static final String RENAME_SYMBOL = "st.renameSymbol";

    /** {@code [uri]}: changes of the working text against the saved text. */
    public static final String PREVIEW_CHANGES = "st.previewChanges";

    /** {@code [uri, changeId]} */
    public static final String REJECT_CHANGE = "st.rejectChange";

    /** {@code [uri]} */
    public static final String UNDO = "st.undo";

    /** {@code [uri]} */
    public static final String REDO = "st.redo";

    /** {@code [uri, line, character]} with a 0-based position, as attached to code lenses. */
    public static final String SHOW_REFERENCES = "st.showReferences";

    public static final String RENAME_MODE_LITERAL = "literal";
    public static final String RENAME_MODE_PATTERN = "pattern";

    public static final List<String> ALL = Collections.unmodifiableList(Arrays.asList(
            ANALYZE_TAGS, EXTRACT_FUNCTION, RENAME_SYMBOL, PREVIEW_CHANGES, REJECT_CHANGE, UNDO, REDO, SHOW_REFERENCES));

    private StCommands() {
    }
}
