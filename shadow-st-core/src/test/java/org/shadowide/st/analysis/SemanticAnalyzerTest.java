package org.shadowide.st.analysis;

import org.junit.jupiter.api.Test;
import org.shadowide.st.rule.RangeRule;
import org.shadowide.st.rule.RuleSeverity;
import org.shadowide.st.rule.ValidationRule;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest {

    private static final String SOURCE = String.join("\n",
            "PROGRAM Main",
            "VAR",
            "  speed : INT := 150;",
            "  spare : BOOL;",
            "  i : INT;",
            "  j : INT;",
            "  k : INT;",
            "  out : REAL;",
            "END_VAR",
            "FOR i := 1 TO 10 DO",
            "  FOR j := 1 TO 10 DO",
            "    FOR k := 1 TO 10 DO",
            "      out := SIN(out) + speed;",
            "    END_FOR;",
            "  END_FOR;",
            "END_FOR;",
            "%QX0.0 := TRUE;",
            "END_PROGRAM");

    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();

    private static AnalysisOptions withSpeedRange() {
        Map<String, List<ValidationRule>> rules = Collections.<String, List<ValidationRule>>singletonMap("Speed",
                Collections.<ValidationRule>singletonList(new RangeRule("r1", 0, 100, null, RuleSeverity.WARNING)));
        return new AnalysisOptions(AnalysisOptions.DEFAULT_MAX_LOOP_DEPTH, rules);
    }

    @Test
    void reportsEachFindingOnItsLine() {
        List<StDiagnostic> diagnostics = analyzer.analyze(SOURCE, withSpeedRange()).getDiagnostics();
        assertEquals(5, diagnostics.size());

        StDiagnostic rule = diagnostics.get(0);
        assertEquals(3, rule.getLine());
        assertEquals(DiagnosticCategory.VALIDATION, rule.getCategory());
        assertEquals(DiagnosticSeverity.WARNING, rule.getSeverity());
        assertEquals("speed: Value must be between 0 and 100", rule.getMessage());

        StDiagnostic unused = diagnostics.get(1);
        assertEquals(4, unused.getLine());
        assertEquals(DiagnosticSeverity.HINT, unused.getSeverity());
        assertEquals("unused-spare", unused.getId());

        StDiagnostic loop = diagnostics.get(2);
        assertEquals(12, loop.getLine());
        assertEquals(DiagnosticSeverity.WARNING, loop.getSeverity());
        assertEquals(4, loop.getColumn());

        StDiagnostic math = diagnostics.get(3);
        assertEquals(13, math.getLine());
        assertEquals(DiagnosticSeverity.INFO, math.getSeverity());

        StDiagnostic io = diagnostics.get(4);
        assertEquals(17, io.getLine());
        assertEquals(DiagnosticSeverity.ERROR, io.getSeverity());
        assertEquals(DiagnosticCategory.UNSAFE_IO, io.getCategory());
    }

    @Test
    void loopLimitIsConfigurable() {
        List<StDiagnostic> diagnostics = analyzer.analyze(SOURCE, new AnalysisOptions(3, null)).getDiagnostics();
        for (StDiagnostic diagnostic : diagnostics) {
            assertFalse(diagnostic.getId().startsWith("loop-depth"));
        }
    }

    @Test
    void estimatesResourceUsage() {
        ResourceUsage usage = analyzer.analyze(SOURCE, AnalysisOptions.defaults()).getResourceUsage();
        assertEquals(13, usage.getMemoryBytes());
        assertEquals(17, usage.getEstimatedCpuPercent());
    }

    @Test
    void commentedCallsAreIgnored() {
        String text = "PROGRAM p\n// x := SIN(1.0); %IX0.0\n(* CONCAT *)\nEND_PROGRAM";
        assertTrue(analyzer.analyze(text, AnalysisOptions.defaults()).getDiagnostics().isEmpty());
    }

    @Test
    void mappedAddressInDeclarationIsAllowed() {
        String text = "PROGRAM p\nVAR\n  start AT %IX0.0 : BOOL;\nEND_VAR\nIF start THEN\nEND_IF;\nEND_PROGRAM";
        assertTrue(analyzer.analyze(text, AnalysisOptions.defaults()).getDiagnostics().isEmpty());
    }

    @Test
    void typeSizes() {
        assertEquals(1, SemanticAnalyzer.estimateTypeSize("BOOL"));
        assertEquals(4, SemanticAnalyzer.estimateTypeSize("DINT"));
        assertEquals(8, SemanticAnalyzer.estimateTypeSize("LREAL"));
        assertEquals(80, SemanticAnalyzer.estimateTypeSize("STRING"));
        assertEquals(20, SemanticAnalyzer.estimateTypeSize("STRING(20)"));
        assertEquals(20, SemanticAnalyzer.estimateTypeSize("ARRAY[1..10] OF INT"));
        assertEquals(4, SemanticAnalyzer.estimateTypeSize("MotorData"));
    }
}
