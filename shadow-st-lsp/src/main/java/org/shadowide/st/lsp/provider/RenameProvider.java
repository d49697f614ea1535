package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PrepareRenameResult;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.shadowide.st.refactor.RenameEngine;
import org.shadowide.st.symbol.StReference;
import org.shadowide.st.text.Identifiers;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renames the identifier under the cursor everywhere in the document.
 */
public class RenameProvider {

    private static final Logger logger = LoggerFactory.getLogger(RenameProvider.class);

    private final RenameEngine renameEngine;

    public RenameProvider() {
        this(new RenameEngine());
    }

    public RenameProvider(RenameEngine renameEngine) {
        this.renameEngine = renameEngine;
    }

    public WorkspaceEdit rename(String content, Position position, String newName, String uri) {
        logger.debug("Rename requested at {}:{} to '{}'", position.getLine(), position.getCharacter(), newName);
        if (!Identifiers.isUsableName(newName)) {
            logger.warn("Invalid identifier name: {}", newName);
            return new WorkspaceEdit();
        }
        String symbol = DocumentRanges.wordAt(content, position);
        if (symbol == null || !Identifiers.isUsableName(symbol)) {
            logger.debug("No symbol found at position {}:{}", position.getLine(), position.getCharacter());
            return new WorkspaceEdit();
        }

        List<TextEdit> edits = new ArrayList<>();
        for (StReference reference : renameEngine.findOccurrences(content, symbol)) {
            edits.add(new TextEdit(
                    DocumentRanges.span(reference.getLine() - 1, reference.getColumn(), reference.getLength()),
                    newName));
        }
        WorkspaceEdit workspaceEdit = new WorkspaceEdit();
        if (!edits.isEmpty()) {
            workspaceEdit.setChanges(Collections.singletonMap(uri, edits));
        }
        logger.debug("Rename of '{}' to '{}' produced {} edits", symbol, newName, edits.size());
        return workspaceEdit;
    }

    /**
     * The identifier range under the cursor, or {@code null} when there is nothing renameable there.
     */
    public PrepareRenameResult prepareRename(String content, Position position) {
        String symbol = DocumentRanges.wordAt(content, position);
        if (symbol == null || !Identifiers.isUsableName(symbol)) {
            return null;
        }
        String line = TextLines.split(content)[position.getLine()];
        int start = Math.min(position.getCharacter(), line.length());
        while (start > 0 && Identifiers.isIdentifierChar(line.charAt(start - 1))) {
            start--;
        }
        return new PrepareRenameResult(DocumentRanges.span(position.getLine(), start, symbol.length()), symbol);
    }
}
