package org.shadowide.st.format;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-indents Structured Text by block nesting.
 * <p>
 * Only leading whitespace changes. A line that begins with a closing keyword ({@code END_IF}, {@code END_VAR}, ...)
 * is emitted one level out; every opening keyword on a line ({@code VAR*}, {@code IF}, {@code FOR}, {@code WHILE},
 * {@code REPEAT}, {@code CASE}, {@code PROGRAM}, {@code FUNCTION}, {@code FUNCTION_BLOCK}) opens a level for the
 * following lines unless a closing keyword later on the same line balances it. {@code ELSE}, {@code ELSIF} and
 * {@code STRUCT} change nothing.
 * <p>
 * Keywords are matched as whole words, case-insensitively, on the raw line. A keyword inside a string literal or a
 * comment therefore still counts.
 */
public class StFormatter {

    private static final Logger logger = LoggerFactory.getLogger(StFormatter.class);

    private static final Pattern OPENING = Pattern.compile(
            "\\b(?:VAR(?:_INPUT|_OUTPUT|_IN_OUT|_GLOBAL|_EXTERNAL|_TEMP)?|IF|FOR|WHILE|REPEAT|CASE|PROGRAM"
                    + "|FUNCTION_BLOCK|FUNCTION)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOSING = Pattern.compile(
            "\\bEND_(?:VAR|IF|FOR|WHILE|REPEAT|CASE|PROGRAM|FUNCTION_BLOCK|FUNCTION)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_CLOSING = Pattern.compile(
            "^END_(?:VAR|IF|FOR|WHILE|REPEAT|CASE|PROGRAM|FUNCTION_BLOCK|FUNCTION)\\b",
            Pattern.CASE_INSENSITIVE);

    public String format(String text, FormatOptions options) {
        Validate.notNull(text, "text");
        Validate.notNull(options, "options");
        String[] lines = TextLines.split(text);
        int[] levels = indentLevels(lines);
        String[] formatted = new String[lines.length];
        for (int i = 0; i < lines.length; i++) {
            formatted[i] = formatLine(lines[i], levels[i], options);
        }
        String result = TextLines.join(formatted);
        if (logger.isDebugEnabled()) {
            logger.debug("Formatted {} lines with {}", lines.length, options);
        }
        return result;
    }

    /**
     * The line as it is emitted at {@code level}: blank lines become empty, others get the level's indent in place
     * of their own leading whitespace.
     */
    public String formatLine(String line, int level, FormatOptions options) {
        if (StringUtils.isBlank(line)) {
            return "";
        }
        return options.indent(level) + StringUtils.stripStart(line, null);
    }

    /**
     * Nesting level each line is emitted at.
     */
    public int[] indentLevels(String[] lines) {
        int[] levels = new int[lines.length];
        int level = 0;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) {
                levels[i] = level;
                continue;
            }
            boolean leadingClose = LEADING_CLOSING.matcher(trimmed).find();
            if (leadingClose) {
                level = Math.max(0, level - 1);
            }
            levels[i] = level;

            int closes = count(CLOSING, trimmed) - (leadingClose ? 1 : 0);
            level = Math.max(0, level + count(OPENING, trimmed) - closes);
        }
        return levels;
    }

    /**
     * Level a new line typed after {@code lineIndex - 1} should start at.
     */
    public int levelAfter(String[] lines, int lineIndex) {
        if (lineIndex <= 0) {
            return 0;
        }
        String[] head = new String[Math.min(lineIndex, lines.length) + 1];
        System.arraycopy(lines, 0, head, 0, head.length - 1);
        head[head.length - 1] = "";
        int[] levels = indentLevels(head);
        return levels[levels.length - 1];
    }

    private static int count(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
