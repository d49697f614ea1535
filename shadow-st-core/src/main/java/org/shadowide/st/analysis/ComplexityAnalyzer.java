package org.shadowide.st.analysis;

import org.shadowide.st.lexer.StLexer;
import org.shadowide.st.lexer.StToken;
import org.shadowide.st.lexer.StTokenType;
import org.shadowide.st.symbol.StSymbol;
import org.shadowide.st.symbol.SymbolExtractor;
import org.shadowide.st.text.TextLines;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cyclomatic complexity per routine: one plus every {@code IF}, {@code ELSIF}, {@code CASE}, loop and boolean
 * {@code AND}/{@code OR} keyword in the body.
 */
public class ComplexityAnalyzer {

    private static final Set<String> BRANCH_KEYWORDS = new HashSet<>(Arrays.asList(
            "IF", "ELSIF", "CASE", "FOR", "WHILE", "REPEAT", "AND", "OR"));

    private final StLexer lexer;
    private final SymbolExtractor symbolExtractor;

    public ComplexityAnalyzer() {
        this(new StLexer(), new SymbolExtractor());
    }

    public ComplexityAnalyzer(StLexer lexer, SymbolExtractor symbolExtractor) {
        this.lexer = lexer;
        this.symbolExtractor = symbolExtractor;
    }

    public List<RoutineMetrics> analyze(String text) {
        List<RoutineMetrics> result = new ArrayList<>();
        List<List<StToken>> tokens = lexer.tokenize(text);
        String[] lines = TextLines.split(text);
        for (StSymbol routine : symbolExtractor.extractRoutines(text)) {
            result.add(measure(routine, lines, tokens));
        }
        return result;
    }

    /**
     * @return {@code null} when no routine has that name
     */
    public RoutineMetrics analyze(String text, String routineName) {
        for (RoutineMetrics metrics : analyze(text)) {
            if (metrics.getRoutineName().equalsIgnoreCase(routineName)) {
                return metrics;
            }
        }
        return null;
    }

    private static RoutineMetrics measure(StSymbol routine, String[] lines, List<List<StToken>> tokens) {
        int linesOfCode = 0;
        int branches = 0;
        int bodyStart = routine.getDeclarationLine();
        int bodyEnd = routine.getEndLine() > routine.getDeclarationLine() ? routine.getEndLine() - 1 : lines.length;
        for (int i = bodyStart; i < bodyEnd && i < lines.length; i++) {
            boolean code = false;
            for (StToken token : tokens.get(i)) {
                if (!token.is(StTokenType.COMMENT)) {
                    code = true;
                }
                if (token.is(StTokenType.KEYWORD)
                        && BRANCH_KEYWORDS.contains(token.getText().toUpperCase(Locale.ROOT))) {
                    branches++;
                }
            }
            if (code) {
                linesOfCode++;
            }
        }
        return new RoutineMetrics(routine.getName(), linesOfCode, routine.getChildren().size(), branches);
    }
}
