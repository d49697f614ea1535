package org.shadowide.st.lexer;

/**
 * Classification of a token span on a line.
 */
public enum StTokenType {
    KEYWORD,
    TYPE,
    IDENTIFIER,
    COMMENT,
    STRING,
    NUMBER,
    OPERATOR,
    /** Unterminated string literal or a character outside the language. */
    INVALID
}
