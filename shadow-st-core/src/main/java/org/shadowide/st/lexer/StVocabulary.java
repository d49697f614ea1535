package org.shadowide.st.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword, type and operator vocabulary of IEC 61131-3 Structured Text. Lookups ignore case.
 */
public final class StVocabulary {

    public static final List<String> KEYWORDS = Collections.unmodifiableList(Arrays.asList(
            "PROGRAM", "END_PROGRAM", "FUNCTION", "END_FUNCTION", "FUNCTION_BLOCK", "END_FUNCTION_BLOCK",
            "VAR", "END_VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_GLOBAL", "VAR_TEMP", "VAR_EXTERNAL",
            "CONSTANT", "RETAIN", "PERSISTENT",
            "IF", "THEN", "ELSIF", "ELSE", "END_IF",
            "CASE", "OF", "END_CASE",
            "FOR", "TO", "BY", "DO", "END_FOR",
            "WHILE", "END_WHILE",
            "REPEAT", "UNTIL", "END_REPEAT",
            "RETURN", "EXIT",
            "AND", "OR", "NOT", "XOR", "MOD",
            "TRUE", "FALSE",
            "ARRAY", "STRUCT", "END_STRUCT", "TYPE", "END_TYPE"
    ));

    public static final List<String> TYPES = Collections.unmodifiableList(Arrays.asList(
            "BOOL", "INT", "DINT", "REAL", "LREAL", "STRING", "WSTRING", "TIME", "LTIME", "DATE", "TOD", "DT",
            "TIME_OF_DAY", "DATE_AND_TIME",
            "SINT", "USINT", "UINT", "UDINT", "LINT", "ULINT", "BYTE", "WORD", "DWORD", "LWORD"
    ));

    /** Two character operators first so the scanner prefers the longest match. */
    public static final List<String> OPERATORS = Collections.unmodifiableList(Arrays.asList(
            ":=", "=>", "<>", "<=", ">=", "**", "..",
            "=", "<", ">", "+", "-", "*", "/", "&", ":", ";", ",", ".", "(", ")", "[", "]", "#", "^"
    ));

    private static final Set<String> KEYWORD_SET = new LinkedHashSet<>(KEYWORDS);
    private static final Set<String> TYPE_SET = new LinkedHashSet<>(TYPES);

    private StVocabulary() {
    }

    public static boolean isKeyword(String word) {
        return word != null && KEYWORD_SET.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isType(String word) {
        return word != null && TYPE_SET.contains(word.toUpperCase(Locale.ROOT));
    }
}
