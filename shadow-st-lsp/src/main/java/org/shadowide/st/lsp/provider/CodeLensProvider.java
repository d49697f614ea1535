package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.CodeLens;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Range;
import org.shadowide.st.analysis.ComplexityAnalyzer;
import org.shadowide.st.analysis.RoutineMetrics;
import org.shadowide.st.lsp.StCommands;
import org.shadowide.st.symbol.StSymbol;
import org.shadowide.st.symbol.SymbolExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reference counts and complexity figures above each routine header.
 */
public class CodeLensProvider {

    private static final Logger logger = LoggerFactory.getLogger(CodeLensProvider.class);

    private final SymbolExtractor symbolExtractor;
    private final ComplexityAnalyzer complexityAnalyzer;

    public CodeLensProvider() {
        this(new SymbolExtractor(), new ComplexityAnalyzer());
    }

    public CodeLensProvider(SymbolExtractor symbolExtractor, ComplexityAnalyzer complexityAnalyzer) {
        this.symbolExtractor = symbolExtractor;
        this.complexityAnalyzer = complexityAnalyzer;
    }

    public List<CodeLens> generateCodeLenses(String uri, String content) {
        if (content == null) {
            return Collections.emptyList();
        }
        try {
            Map<String, RoutineMetrics> metrics = new HashMap<>();
            for (RoutineMetrics routine : complexityAnalyzer.analyze(content)) {
                metrics.put(routine.getRoutineName().toUpperCase(Locale.ROOT), routine);
            }
            List<CodeLens> lenses = new ArrayList<>();
            for (StSymbol routine : symbolExtractor.extractRoutines(content)) {
                int line = routine.getDeclarationLine() - 1;
                Range range = DocumentRanges.span(line, routine.getColumn(), routine.getName().length());

                int count = routine.getReferenceCount();
                Command references = new Command(count == 1 ? "1 reference" : count + " references",
                        StCommands.SHOW_REFERENCES,
                        Arrays.<Object>asList(uri, line, routine.getColumn()));
                lenses.add(new CodeLens(range, references, null));

                RoutineMetrics routineMetrics = metrics.get(routine.getName().toUpperCase(Locale.ROOT));
                if (routineMetrics != null) {
                    Command complexity = new Command("complexity " + routineMetrics.getCyclomaticComplexity()
                            + ", " + routineMetrics.getLinesOfCode() + " lines, "
                            + routineMetrics.getNumberOfVariables() + " variables", "");
                    lenses.add(new CodeLens(range, complexity, null));
                }
            }
            return lenses;
        } catch (Exception e) {
            logger.error("Error generating code lenses", e);
            return Collections.emptyList();
        }
    }

    public CodeLens resolveCodeLens(CodeLens unresolved) {
        return unresolved;
    }
}
