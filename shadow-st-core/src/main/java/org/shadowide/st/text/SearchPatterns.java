package org.shadowide.st.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles user supplied search patterns. A pattern that does not compile is matched literally instead.
 */
public final class SearchPatterns {

    private static final Logger logger = LoggerFactory.getLogger(SearchPatterns.class);

    private SearchPatterns() {
    }

    /**
     * Whole-word, case-insensitive pattern for an identifier. The name is quoted, never interpreted.
     */
    public static Pattern wholeWord(String name) {
        return Pattern.compile("\\b" + Pattern.quote(name) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Case-insensitive pattern for a user query, falling back to a literal match when the query is not a
     * valid regular expression.
     */
    public static Pattern userPattern(String query) {
        try {
            return Pattern.compile(query, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            logger.warn("Invalid search pattern '{}', falling back to literal match: {}", query, e.getDescription());
            return Pattern.compile(Pattern.quote(query), Pattern.CASE_INSENSITIVE);
        }
    }

    public static boolean isValidRegex(String query) {
        try {
            Pattern.compile(query);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
