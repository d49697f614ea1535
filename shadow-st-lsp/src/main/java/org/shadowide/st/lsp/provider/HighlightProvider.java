package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightKind;
import org.shadowide.st.refactor.RenameEngine;
import org.shadowide.st.symbol.StReference;
import org.shadowide.st.text.TextLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Highlights every occurrence of a symbol, marking assignment targets as writes.
 */
public class HighlightProvider {

    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*:=");

    private final RenameEngine renameEngine;

    public HighlightProvider() {
        this(new RenameEngine());
    }

    public HighlightProvider(RenameEngine renameEngine) {
        this.renameEngine = renameEngine;
    }

    public List<DocumentHighlight> findSymbolHighlights(String content, String symbol) {
        List<DocumentHighlight> highlights = new ArrayList<>();
        String[] lines = TextLines.split(content);
        for (StReference reference : renameEngine.findOccurrences(content, symbol)) {
            String line = lines[reference.getLine() - 1];
            String rest = line.substring(reference.getColumn() + reference.getLength());
            DocumentHighlightKind kind = ASSIGNMENT.matcher(rest).find()
                    ? DocumentHighlightKind.Write : DocumentHighlightKind.Read;
            highlights.add(new DocumentHighlight(
                    DocumentRanges.span(reference.getLine() - 1, reference.getColumn(), reference.getLength()), kind));
        }
        return highlights;
    }
}
