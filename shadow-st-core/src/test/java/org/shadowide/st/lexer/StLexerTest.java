package org.shadowide.st.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StLexerTest {

    private final StLexer lexer = new StLexer();

    private List<StToken> tokens(String line) {
        return lexer.tokenizeLine(line, LexerState.ROOT).getTokens();
    }

    @Test
    void classifiesIfStatement() {
        List<StToken> tokens = tokens("IF x > 10 THEN");
        assertEquals(5, tokens.size());
        assertEquals(StTokenType.KEYWORD, tokens.get(0).getType());
        assertEquals(0, tokens.get(0).getStart());
        assertEquals(2, tokens.get(0).getEnd());
        assertEquals(StTokenType.IDENTIFIER, tokens.get(1).getType());
        assertEquals(StTokenType.OPERATOR, tokens.get(2).getType());
        assertEquals(StTokenType.NUMBER, tokens.get(3).getType());
        assertEquals("10", tokens.get(3).getText());
        assertEquals(StTokenType.KEYWORD, tokens.get(4).getType());
        assertEquals(10, tokens.get(4).getStart());
    }

    @Test
    void keywordsAndTypesIgnoreCase() {
        List<StToken> tokens = tokens("counter : int := 0; if");
        assertEquals(StTokenType.IDENTIFIER, tokens.get(0).getType());
        assertEquals(StTokenType.TYPE, tokens.get(2).getType());
        assertEquals(":=", tokens.get(3).getText());
        assertEquals(StTokenType.KEYWORD, tokens.get(tokens.size() - 1).getType());
    }

    @Test
    void unterminatedStringIsInvalidToEndOfLine() {
        List<StToken> tokens = tokens("x := 'abc");
        StToken last = tokens.get(tokens.size() - 1);
        assertEquals(StTokenType.INVALID, last.getType());
        assertEquals(5, last.getStart());
        assertEquals(9, last.getEnd());
    }

    @Test
    void stringHonoursEscapes() {
        List<StToken> tokens = tokens("s := \"a\\\"b\";");
        assertEquals(StTokenType.STRING, tokens.get(2).getType());
        assertEquals(5, tokens.get(2).getStart());
        assertEquals(11, tokens.get(2).getEnd());
        assertEquals(";", tokens.get(3).getText());
    }

    @Test
    void blockCommentContinuesOnNextLine() {
        StLexer.LineTokens first = lexer.tokenizeLine("x (* start", LexerState.ROOT);
        assertEquals(LexerState.BLOCK_COMMENT, first.getEndState());
        assertEquals(StTokenType.COMMENT, first.getTokens().get(1).getType());

        StLexer.LineTokens second = lexer.tokenizeLine("end *) y", first.getEndState());
        assertEquals(LexerState.ROOT, second.getEndState());
        assertEquals(StTokenType.COMMENT, second.getTokens().get(0).getType());
        assertEquals(6, second.getTokens().get(0).getEnd());
        assertEquals(StTokenType.IDENTIFIER, second.getTokens().get(1).getType());
    }

    @Test
    void lineCommentRunsToEnd() {
        List<StToken> tokens = tokens("a := 1; // IF THEN");
        StToken last = tokens.get(tokens.size() - 1);
        assertEquals(StTokenType.COMMENT, last.getType());
        assertEquals("// IF THEN", last.getText());
    }

    @Test
    void literalsAreNumbers() {
        assertEquals(StTokenType.NUMBER, tokens("T#5s").get(0).getType());
        assertEquals("T#5s", tokens("T#5s").get(0).getText());
        assertEquals("16#FF", tokens("16#FF").get(0).getText());
        assertEquals("3.14", tokens("3.14").get(0).getText());
        assertEquals("1.5E3", tokens("1.5E3").get(0).getText());
    }

    @Test
    void directAddressIsOneIdentifier() {
        List<StToken> tokens = tokens("%IX0.1 := TRUE;");
        assertEquals(StTokenType.IDENTIFIER, tokens.get(0).getType());
        assertEquals("%IX0.1", tokens.get(0).getText());
    }

    @Test
    void tokenizeReturnsOneListPerLine() {
        List<List<StToken>> lines = lexer.tokenize("(* a\nb *)\nc");
        assertEquals(3, lines.size());
        assertEquals(StTokenType.COMMENT, lines.get(1).get(0).getType());
        assertEquals(StTokenType.IDENTIFIER, lines.get(2).get(0).getType());
    }
}
