package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.shadowide.st.text.TextLines;

/**
 * Conversions between document text and LSP ranges. LSP lines are 0-based.
 */
public final class DocumentRanges {

    private DocumentRanges() {
    }

    public static Range wholeDocument(String content) {
        String[] lines = TextLines.split(content);
        int last = lines.length - 1;
        return new Range(new Position(0, 0), new Position(last, lines[last].length()));
    }

    public static Range line(String[] lines, int line) {
        int length = line >= 0 && line < lines.length ? lines[line].length() : 0;
        return new Range(new Position(line, 0), new Position(line, length));
    }

    public static Range span(int line, int column, int length) {
        return new Range(new Position(line, column), new Position(line, column + length));
    }

    /**
     * The identifier under an LSP position, or {@code null}.
     */
    public static String wordAt(String content, Position position) {
        if (content == null || position == null) {
            return null;
        }
        String[] lines = TextLines.split(content);
        if (position.getLine() < 0 || position.getLine() >= lines.length) {
            return null;
        }
        return org.shadowide.st.text.Identifiers.wordAt(lines[position.getLine()], position.getCharacter());
    }
}
