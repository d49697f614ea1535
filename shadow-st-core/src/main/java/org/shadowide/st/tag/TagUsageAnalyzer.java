package org.shadowide.st.tag;

import org.shadowide.st.symbol.VarDeclaration;
import org.shadowide.st.symbol.VarDeclarationParser;
import org.shadowide.st.text.SearchPatterns;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds the variables a document declares and the lines each one is written on.
 * <p>
 * Declarations are read flat from every {@code VAR*...END_VAR} block. Occurrences are whole-word, case-insensitive
 * matches on every line, comments and strings included. Results list used tags first, then by descending usage
 * count, then by name ignoring case.
 */
public class TagUsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TagUsageAnalyzer.class);

    static final Comparator<DeclaredTag> ORDER = Comparator
            .comparing((DeclaredTag tag) -> !tag.isUsed())
            .thenComparing(DeclaredTag::getUsageCount, Comparator.reverseOrder())
            .thenComparing(DeclaredTag::getName, String.CASE_INSENSITIVE_ORDER);

    public List<DeclaredTag> analyze(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String[] lines = TextLines.split(text);
        List<VarDeclaration> declarations = declarations(lines);
        if (declarations.isEmpty()) {
            return Collections.emptyList();
        }
        List<DeclaredTag> tags = new ArrayList<>(declarations.size());
        for (VarDeclaration declaration : declarations) {
            tags.add(new DeclaredTag(declaration.getName(), declaration.getDataType(), declaration.getInitialValue(),
                    declaration.getDescription(), declaration.getLine(),
                    linesContaining(lines, declaration.getName())));
        }
        tags.sort(ORDER);
        logger.debug("Analyzed {} declared tags", tags.size());
        return tags;
    }

    /**
     * Declared tags whose name matches {@code query}, a case-insensitive regular expression. A query that does not
     * compile is matched as a literal substring. A blank query returns every tag.
     */
    public List<DeclaredTag> search(String text, String query) {
        List<DeclaredTag> tags = analyze(text);
        if (query == null || query.trim().isEmpty()) {
            return tags;
        }
        Pattern pattern = SearchPatterns.userPattern(query);
        List<DeclaredTag> matches = new ArrayList<>();
        for (DeclaredTag tag : tags) {
            if (pattern.matcher(tag.getName()).find()) {
                matches.add(tag);
            }
        }
        return matches;
    }

    /**
     * Declarations in document order.
     */
    public List<VarDeclaration> declarations(String[] lines) {
        List<VarDeclaration> declarations = new ArrayList<>();
        String section = null;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            String blockStart = VarDeclarationParser.blockStart(trimmed);
            if (blockStart != null) {
                section = blockStart;
                continue;
            }
            if (VarDeclarationParser.isBlockEnd(trimmed)) {
                section = null;
                continue;
            }
            if (section != null) {
                VarDeclaration declaration = VarDeclarationParser.parse(lines[i], i + 1, section);
                if (declaration != null) {
                    declarations.add(declaration);
                }
            }
        }
        return declarations;
    }

    private static List<Integer> linesContaining(String[] lines, String name) {
        Pattern pattern = SearchPatterns.wholeWord(name);
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (pattern.matcher(lines[i]).find()) {
                result.add(i + 1);
            }
        }
        return result;
    }
}
