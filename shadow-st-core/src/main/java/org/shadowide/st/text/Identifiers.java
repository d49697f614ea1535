package org.shadowide.st.text;

import org.shadowide.st.lexer.StVocabulary;

import java.util.regex.Pattern;

/**
 * Identifier rules of Structured Text.
 */
public final class Identifiers {

    public static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private Identifiers() {
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * An identifier that is also not a reserved keyword or elementary type name.
     */
    public static boolean isUsableName(String name) {
        return isIdentifier(name) && !StVocabulary.isKeyword(name) && !StVocabulary.isType(name);
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * The identifier under {@code character} in {@code line}, or {@code null} when the position is not on one.
     */
    public static String wordAt(String line, int character) {
        if (line == null || character < 0 || character > line.length()) {
            return null;
        }
        int start = character;
        int end = character;
        while (start > 0 && isIdentifierChar(line.charAt(start - 1))) {
            start--;
        }
        while (end < line.length() && isIdentifierChar(line.charAt(end))) {
            end++;
        }
        if (start < end) {
            return line.substring(start, end);
        }
        return null;
    }
}
