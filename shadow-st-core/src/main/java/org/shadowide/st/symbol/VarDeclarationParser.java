package org.shadowide.st.symbol;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes declaration block boundaries and single variable declarations.
 */
public final class VarDeclarationParser {

    private static final Logger logger = LoggerFactory.getLogger(VarDeclarationParser.class);

    private static final Pattern BLOCK_START = Pattern.compile(
            "^(VAR(?:_INPUT|_OUTPUT|_IN_OUT|_GLOBAL|_EXTERNAL|_TEMP)?)(?:\\s+(?:CONSTANT|RETAIN|PERSISTENT))*\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCK_END = Pattern.compile("^END_VAR\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DECLARATION = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)(?:\\s+AT\\s+%[A-Za-z0-9_.*]+)?\\s*:\\s*"
                    + "((?:ARRAY\\s*\\[[^\\]]*\\]\\s*OF\\s+)?[A-Za-z_][A-Za-z0-9_]*(?:\\([^)]*\\)|\\[[^\\]]*\\])?)"
                    + "\\s*(?::=\\s*([^;]+))?\\s*;?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCK_COMMENT = Pattern.compile("\\(\\*(.*?)\\*\\)");

    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$");

    private VarDeclarationParser() {
    }

    /**
     * Upper-cased block keyword when {@code trimmed} opens a declaration block, else {@code null}.
     */
    public static String blockStart(String trimmed) {
        Matcher matcher = BLOCK_START.matcher(trimmed);
        return matcher.matches() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
    }

    public static boolean isBlockEnd(String trimmed) {
        return BLOCK_END.matcher(trimmed).matches();
    }

    /**
     * Parses a line inside a declaration block. Comment-only and blank lines, and lines that are not a single
     * declaration, yield {@code null}.
     *
     * @param line       raw line
     * @param lineNumber 1-based
     * @param section    enclosing block keyword
     */
    public static VarDeclaration parse(String line, int lineNumber, String section) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("//")) {
            return null;
        }
        if (trimmed.startsWith("(*") && trimmed.endsWith("*)")) {
            return null;
        }
        String code = LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(trimmed).replaceAll("")).replaceAll("").trim();
        if (code.isEmpty()) {
            return null;
        }
        Matcher matcher = DECLARATION.matcher(code);
        if (!matcher.matches()) {
            logger.debug("Skipping malformed declaration on line {}: {}", lineNumber, trimmed);
            return null;
        }
        String name = matcher.group(1);
        String initialValue = StringUtils.trimToNull(matcher.group(3));
        String description = null;
        Matcher comment = BLOCK_COMMENT.matcher(trimmed);
        if (comment.find()) {
            description = StringUtils.trimToNull(comment.group(1));
        }
        return new VarDeclaration(name, matcher.group(2).trim(), initialValue, description, section, lineNumber,
                columnOf(line, name));
    }

    private static int columnOf(String line, String name) {
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(line);
        return matcher.find() ? matcher.start() : Math.max(0, line.indexOf(name));
    }
}
