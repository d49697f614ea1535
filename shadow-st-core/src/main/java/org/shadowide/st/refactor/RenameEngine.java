package org.shadowide.st.refactor;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.shadowide.st.symbol.StReference;
import org.shadowide.st.text.SearchPatterns;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-document text substitution for renaming a symbol.
 * <p>
 * Every whole-word, case-insensitive occurrence is replaced, the declaration and comments included. The new name is
 * inserted literally and is not validated here.
 */
public class RenameEngine {

    private static final Logger logger = LoggerFactory.getLogger(RenameEngine.class);

    public RenameResult rename(String text, String oldName, String newName) {
        Validate.notNull(text, "text");
        Validate.notNull(newName, "newName");
        if (StringUtils.isEmpty(oldName)) {
            return new RenameResult(text, 0, Collections.<Integer>emptyList());
        }
        RenameResult result = replace(text, SearchPatterns.wholeWord(oldName), newName);
        logger.debug("Renamed '{}' to '{}': {}", oldName, newName, result);
        return result;
    }

    /**
     * Replaces every match of a user pattern. A pattern that does not compile is matched literally.
     */
    public RenameResult renameMatching(String text, String pattern, String newName) {
        Validate.notNull(text, "text");
        Validate.notNull(newName, "newName");
        if (StringUtils.isEmpty(pattern)) {
            return new RenameResult(text, 0, Collections.<Integer>emptyList());
        }
        RenameResult result = replace(text, SearchPatterns.userPattern(pattern), newName);
        logger.debug("Replaced matches of '{}' with '{}': {}", pattern, newName, result);
        return result;
    }

    /**
     * Whole-word, case-insensitive occurrences of {@code name} in document order.
     */
    public List<StReference> findOccurrences(String text, String name) {
        List<StReference> occurrences = new ArrayList<>();
        if (text == null || StringUtils.isEmpty(name)) {
            return occurrences;
        }
        Pattern pattern = SearchPatterns.wholeWord(name);
        String[] lines = TextLines.split(text);
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = pattern.matcher(lines[i]);
            while (matcher.find()) {
                occurrences.add(new StReference(i + 1, matcher.start(), matcher.end() - matcher.start()));
            }
        }
        return occurrences;
    }

    private static RenameResult replace(String text, Pattern pattern, String replacement) {
        String[] lines = TextLines.split(text);
        List<Integer> affectedLines = new ArrayList<>();
        int changes = 0;
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = pattern.matcher(lines[i]);
            StringBuilder sb = null;
            int last = 0;
            while (matcher.find()) {
                // empty matches would insert the replacement between every character
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                if (sb == null) {
                    sb = new StringBuilder(lines[i].length() + replacement.length());
                }
                sb.append(lines[i], last, matcher.start()).append(replacement);
                last = matcher.end();
                changes++;
            }
            if (sb != null) {
                sb.append(lines[i], last, lines[i].length());
                lines[i] = sb.toString();
                affectedLines.add(i + 1);
            }
        }
        if (changes == 0) {
            return new RenameResult(text, 0, affectedLines);
        }
        return new RenameResult(TextLines.join(lines), changes, affectedLines);
    }
}
