package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Test;
import org.shadowide.st.lsp.config.StLspSettings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormattingProviderTest {

    private final FormattingProvider provider = new FormattingProvider(new StLspSettings());

    @Test
    void formatsWholeDocumentAsOneEdit() {
        String text = "PROGRAM Main\nIF a THEN\nb := 1;\nEND_IF\nEND_PROGRAM";
        List<TextEdit> edits = provider.formatDocument(text, new FormattingOptions(4, true));
        assertEquals(1, edits.size());
        assertEquals("PROGRAM Main\n    IF a THEN\n        b := 1;\n    END_IF\nEND_PROGRAM", edits.get(0).getNewText());
        assertEquals(new Range(new Position(0, 0), new Position(4, 11)), edits.get(0).getRange());
    }

    @Test
    void formattedDocumentNeedsNoEdit() {
        String text = "IF a THEN\n  b := 1;\nEND_IF";
        assertTrue(provider.formatDocument(text, new FormattingOptions(2, true)).isEmpty());
    }

    @Test
    void missingClientOptionsUseConfiguredDefaults() {
        StLspSettings settings = new StLspSettings();
        settings.setTabSize(3);
        FormattingProvider configured = new FormattingProvider(settings);
        List<TextEdit> edits = configured.formatDocument("IF a THEN\nb := 1;\nEND_IF", null);
        assertEquals("IF a THEN\n   b := 1;\nEND_IF", edits.get(0).getNewText());
    }

    @Test
    void rangeFormattingTouchesOnlySelectedLines() {
        String text = "IF a THEN\nb := 1;\nc := 2;\nEND_IF";
        List<TextEdit> edits = provider.formatRange(text, new Range(new Position(2, 0), new Position(2, 7)),
                new FormattingOptions(2, true));
        assertEquals(1, edits.size());
        assertEquals(2, edits.get(0).getRange().getStart().getLine());
        assertEquals("  c := 2;", edits.get(0).getNewText());
    }

    @Test
    void newLineIsIndentedToEnclosingBlock() {
        String text = "WHILE a DO\n";
        List<TextEdit> edits = provider.formatOnType(text, new Position(1, 0), "\n", new FormattingOptions(2, true));
        assertEquals(1, edits.size());
        assertEquals("  ", edits.get(0).getNewText());
    }

    @Test
    void otherTriggerCharactersAreIgnored() {
        assertTrue(provider.formatOnType("a", new Position(0, 1), "x", new FormattingOptions(2, true)).isEmpty());
    }
}
