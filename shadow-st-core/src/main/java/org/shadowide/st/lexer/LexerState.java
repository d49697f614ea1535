package org.shadowide.st.lexer;

/**
 * State carried from the end of one line to the start of the next.
 */
public enum LexerState {
    ROOT,
    DOUBLE_QUOTED_STRING,
    SINGLE_QUOTED_STRING,
    BLOCK_COMMENT
}
