package org.shadowide.st.tag;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TagUsageAnalyzerTest {

    private final TagUsageAnalyzer analyzer = new TagUsageAnalyzer();

    private static final String TAGS = String.join("\n",
            "VAR",
            "  b : INT;",
            "  a : INT;",
            "  c : INT;",
            "  d : INT;",
            "END_VAR",
            "c := 1;",
            "c := a;",
            "b := 2;");

    @Test
    void reportsDeclarationAndUsageLines() {
        List<DeclaredTag> tags = analyzer.analyze("VAR\n  X : INT;\nEND_VAR\nX := X + 1;");
        assertEquals(1, tags.size());
        DeclaredTag x = tags.get(0);
        assertEquals("X", x.getName());
        assertEquals("INT", x.getType());
        assertEquals(2, x.getDeclarationLine());
        assertEquals(Arrays.asList(4), x.getUsageLines());
        assertEquals(Arrays.asList(2, 4), x.getAllLines());
        assertTrue(x.isUsed());
    }

    @Test
    void sortsUsedFirstThenByCountThenByName() {
        List<String> names = analyzer.analyze(TAGS).stream().map(DeclaredTag::getName).collect(Collectors.toList());
        assertEquals(Arrays.asList("c", "a", "b", "d"), names);
    }

    @Test
    void nameTieBreakIgnoresCase() {
        List<String> names = analyzer.analyze("VAR\n  Z : INT;\n  b : INT;\n  A : INT;\nEND_VAR").stream()
                .map(DeclaredTag::getName).collect(Collectors.toList());
        assertEquals(Arrays.asList("A", "b", "Z"), names);
    }

    @Test
    void unusedTagHasNoUsageLines() {
        DeclaredTag d = analyzer.analyze(TAGS).get(3);
        assertFalse(d.isUsed());
        assertEquals(0, d.getUsageCount());
        assertEquals(Arrays.asList(5), d.getAllLines());
    }

    @Test
    void emptyOrUndeclaredTextYieldsNothing() {
        assertTrue(analyzer.analyze("").isEmpty());
        assertTrue(analyzer.analyze(null).isEmpty());
        assertTrue(analyzer.analyze("x := 1;\ny := x;").isEmpty());
    }

    @Test
    void capturesInitialValueAndComment() {
        DeclaredTag speed = analyzer.analyze("VAR_INPUT\n  Speed : REAL := 1.5; (* rpm setpoint *)\nEND_VAR").get(0);
        assertEquals("1.5", speed.getInitialValue());
        assertEquals("rpm setpoint", speed.getDescription());
    }

    @Test
    void matchesWholeWordsIgnoringCase() {
        DeclaredTag x = analyzer.analyze("VAR\n  x : INT;\nEND_VAR\nX := 1;\nxx := 2;\n// x in comment").get(0);
        assertEquals(Arrays.asList(4, 6), x.getUsageLines());
    }

    @Test
    void searchUsesRegexOrLiteral() {
        List<String> regex = analyzer.search(TAGS, "^[ab]$").stream().map(DeclaredTag::getName)
                .collect(Collectors.toList());
        assertEquals(Arrays.asList("a", "b"), regex);
        assertTrue(analyzer.search(TAGS, "[").isEmpty());
        assertEquals("c", analyzer.search(TAGS, "C").get(0).getName());
        assertEquals(4, analyzer.search(TAGS, " ").size());
    }
}
