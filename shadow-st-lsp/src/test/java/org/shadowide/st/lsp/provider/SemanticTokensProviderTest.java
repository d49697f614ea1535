package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SemanticTokenTypes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticTokensProviderTest {

    private final SemanticTokensProvider provider = new SemanticTokensProvider();

    @Test
    void encodesTokensRelativeToPreviousToken() {
        List<Integer> data = provider.generateSemanticTokens("VAR\n  Count : INT;\nEND_VAR");
        assertEquals(Arrays.asList(
                0, 0, 3, 0, 0,
                1, 2, 5, 2, 1,
                0, 6, 1, 8, 0,
                0, 2, 3, 1, 0,
                0, 3, 1, 8, 0,
                1, 0, 7, 0, 0), data);
    }

    @Test
    void routineNamesAreFunctions() {
        String text = "FUNCTION Scale : INT\nEND_FUNCTION\nx := Scale(1);";
        List<Integer> data = provider.generateSemanticTokens(text);
        int function = SemanticTokensProvider.TOKEN_TYPES.indexOf(SemanticTokenTypes.Function);
        // FUNCTION, Scale
        assertEquals(function, data.get(5 + 3));
        assertEquals(1, data.get(5 + 4));
        // x, :=, Scale on line 3
        assertEquals(function, data.get(5 * 7 + 3));
        assertEquals(0, data.get(5 * 7 + 4));
    }

    @Test
    void rangeOnlyCoversRequestedLines() {
        String text = "(* block\ncomment *)\nx := 1;";
        List<Integer> data = provider.generateSemanticTokens(text, new Range(new Position(1, 0), new Position(1, 10)));
        int comment = SemanticTokensProvider.TOKEN_TYPES.indexOf(SemanticTokenTypes.Comment);
        assertEquals(Arrays.asList(1, 0, 10, comment, 0), data);
    }

    @Test
    void emptyDocumentHasNoTokens() {
        assertTrue(provider.generateSemanticTokens("").isEmpty());
    }

    @Test
    void legendMatchesTokenTypes() {
        assertEquals(SemanticTokensProvider.TOKEN_TYPES, SemanticTokensProvider.legend().getTokenTypes());
    }
}
