package org.shadowide.st.lexer;

import org.shadowide.st.text.TextLines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line oriented tokenizer for Structured Text.
 * <p>
 * Each call classifies one line given the state left by the previous line, so a host can re-tokenize only the
 * lines it repaints. Unknown identifiers are never an error. A string that is not closed on its line becomes an
 * {@link StTokenType#INVALID} span up to the end of the line, unless the line ends with a backslash, in which
 * case the string continues on the next line.
 */
public class StLexer {

    /**
     * Tokens of one line together with the state to hand to the next line.
     */
    public static final class LineTokens {

        private final List<StToken> tokens;
        private final LexerState endState;

        LineTokens(List<StToken> tokens, LexerState endState) {
            this.tokens = Collections.unmodifiableList(tokens);
            this.endState = endState;
        }

        public List<StToken> getTokens() {
            return tokens;
        }

        public LexerState getEndState() {
            return endState;
        }
    }

    public LineTokens tokenizeLine(String line, LexerState state) {
        List<StToken> tokens = new ArrayList<>();
        int len = line.length();
        int i = 0;
        LexerState current = state == null ? LexerState.ROOT : state;

        if (current == LexerState.BLOCK_COMMENT) {
            int close = line.indexOf("*)");
            if (close < 0) {
                if (len > 0) {
                    addToken(tokens, StTokenType.COMMENT, line, 0, len);
                }
                return new LineTokens(tokens, LexerState.BLOCK_COMMENT);
            }
            addToken(tokens, StTokenType.COMMENT, line, 0, close + 2);
            i = close + 2;
            current = LexerState.ROOT;
        } else if (current == LexerState.DOUBLE_QUOTED_STRING || current == LexerState.SINGLE_QUOTED_STRING) {
            char quote = current == LexerState.DOUBLE_QUOTED_STRING ? '"' : '\'';
            int close = findClosingQuote(line, 0, quote);
            if (close < 0) {
                if (len > 0) {
                    addToken(tokens, line.endsWith("\\") ? StTokenType.STRING : StTokenType.INVALID, line, 0, len);
                }
                return new LineTokens(tokens, line.endsWith("\\") ? current : LexerState.ROOT);
            }
            addToken(tokens, StTokenType.STRING, line, 0, close + 1);
            i = close + 1;
            current = LexerState.ROOT;
        }

        while (i < len) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (line.startsWith("(*", i)) {
                int close = line.indexOf("*)", i + 2);
                if (close < 0) {
                    addToken(tokens, StTokenType.COMMENT, line, i, len);
                    return new LineTokens(tokens, LexerState.BLOCK_COMMENT);
                }
                addToken(tokens, StTokenType.COMMENT, line, i, close + 2);
                i = close + 2;
            } else if (line.startsWith("//", i)) {
                addToken(tokens, StTokenType.COMMENT, line, i, len);
                i = len;
            } else if (c == '"' || c == '\'') {
                int close = findClosingQuote(line, i + 1, c);
                if (close < 0 && line.endsWith("\\")) {
                    // backslash continuation carries the string onto the next line
                    addToken(tokens, StTokenType.STRING, line, i, len);
                    return new LineTokens(tokens,
                            c == '"' ? LexerState.DOUBLE_QUOTED_STRING : LexerState.SINGLE_QUOTED_STRING);
                } else if (close < 0) {
                    addToken(tokens, StTokenType.INVALID, line, i, len);
                    i = len;
                } else {
                    addToken(tokens, StTokenType.STRING, line, i, close + 1);
                    i = close + 1;
                }
            } else if (Character.isLetter(c) || c == '_') {
                i = scanWord(tokens, line, i);
            } else if (Character.isDigit(c)) {
                int end = scanNumber(line, i);
                addToken(tokens, StTokenType.NUMBER, line, i, end);
                i = end;
            } else if (c == '%' && i + 1 < len && "IQMiqm".indexOf(line.charAt(i + 1)) >= 0) {
                int end = i + 2;
                while (end < len && (Character.isLetterOrDigit(line.charAt(end)) || line.charAt(end) == '.')) {
                    end++;
                }
                addToken(tokens, StTokenType.IDENTIFIER, line, i, end);
                i = end;
            } else {
                String operator = matchOperator(line, i);
                if (operator != null) {
                    addToken(tokens, StTokenType.OPERATOR, line, i, i + operator.length());
                    i += operator.length();
                } else {
                    addToken(tokens, StTokenType.INVALID, line, i, i + 1);
                    i++;
                }
            }
        }
        return new LineTokens(tokens, current);
    }

    /**
     * Tokenizes a whole document, one token list per line.
     */
    public List<List<StToken>> tokenize(String text) {
        List<List<StToken>> result = new ArrayList<>();
        LexerState state = LexerState.ROOT;
        for (String line : TextLines.split(text)) {
            LineTokens lineTokens = tokenizeLine(line, state);
            result.add(lineTokens.getTokens());
            state = lineTokens.getEndState();
        }
        return result;
    }

    private int scanWord(List<StToken> tokens, String line, int start) {
        int len = line.length();
        int end = start;
        while (end < len && (Character.isLetterOrDigit(line.charAt(end)) || line.charAt(end) == '_')) {
            end++;
        }
        // typed and time literals: T#5s, TIME#1h2m, INT#16#FF, BOOL#TRUE
        if (end + 1 < len && line.charAt(end) == '#' && isLiteralChar(line.charAt(end + 1))) {
            int literalEnd = end + 1;
            while (literalEnd < len && (isLiteralChar(line.charAt(literalEnd)) || line.charAt(literalEnd) == '#')) {
                literalEnd++;
            }
            addToken(tokens, StTokenType.NUMBER, line, start, literalEnd);
            return literalEnd;
        }
        String word = line.substring(start, end);
        StTokenType type;
        if (StVocabulary.isKeyword(word)) {
            type = StTokenType.KEYWORD;
        } else if (StVocabulary.isType(word)) {
            type = StTokenType.TYPE;
        } else {
            type = StTokenType.IDENTIFIER;
        }
        tokens.add(new StToken(type, start, end, word));
        return end;
    }

    private static boolean isLiteralChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':' || c == '-';
    }

    private static int scanNumber(String line, int start) {
        int len = line.length();
        int end = start;
        while (end < len && (Character.isDigit(line.charAt(end)) || line.charAt(end) == '_')) {
            end++;
        }
        if (end + 1 < len && line.charAt(end) == '#') {
            // radix literal: 2#1010, 16#FF
            end++;
            while (end < len && (Character.digit(line.charAt(end), 16) >= 0 || line.charAt(end) == '_')) {
                end++;
            }
            return end;
        }
        if (end + 1 < len && line.charAt(end) == '.' && Character.isDigit(line.charAt(end + 1))) {
            end++;
            while (end < len && (Character.isDigit(line.charAt(end)) || line.charAt(end) == '_')) {
                end++;
            }
        }
        if (end < len && (line.charAt(end) == 'e' || line.charAt(end) == 'E')) {
            int exp = end + 1;
            if (exp < len && (line.charAt(exp) == '+' || line.charAt(exp) == '-')) {
                exp++;
            }
            if (exp < len && Character.isDigit(line.charAt(exp))) {
                end = exp;
                while (end < len && Character.isDigit(line.charAt(end))) {
                    end++;
                }
            }
        }
        return end;
    }

    /**
     * Index of the closing quote at or after {@code from}, honouring backslash and doubled-quote escapes.
     */
    private static int findClosingQuote(String line, int from, char quote) {
        int i = from;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\' || c == '$') {
                i += 2;
            } else if (c == quote) {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static String matchOperator(String line, int i) {
        for (String operator : StVocabulary.OPERATORS) {
            if (line.startsWith(operator, i)) {
                return operator;
            }
        }
        return null;
    }

    private static void addToken(List<StToken> tokens, StTokenType type, String line, int start, int end) {
        tokens.add(new StToken(type, start, end, line.substring(start, end)));
    }
}
