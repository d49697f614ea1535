package org.shadowide.st.text;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Line splitting helpers shared by the engines.
 * <p>
 * Splitting keeps trailing empty lines so that {@code join(split(text)) == text} for any input.
 */
public final class TextLines {

    private TextLines() {
    }

    public static String[] split(String text) {
        if (text == null) {
            return new String[]{""};
        }
        return text.split("\n", -1);
    }

    public static List<String> splitToList(String text) {
        return Arrays.asList(split(text));
    }

    public static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    public static String join(String[] lines) {
        return String.join("\n", lines);
    }

    public static int lineCount(String text) {
        return split(text).length;
    }

    /**
     * Leading whitespace of {@code line}, i.e. everything before the first non-blank character.
     */
    public static String indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }

    public static boolean isBlank(String line) {
        return StringUtils.isBlank(line);
    }

    /**
     * Whether the trimmed line opens with a line comment or a block comment.
     */
    public static boolean isCommentLine(String trimmed) {
        return trimmed.startsWith("//") || trimmed.startsWith("(*");
    }
}
