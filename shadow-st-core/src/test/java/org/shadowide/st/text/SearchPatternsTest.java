package org.shadowide.st.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchPatternsTest {

    @Test
    void wholeWordQuotesName() {
        assertTrue(SearchPatterns.wholeWord("a.b").matcher("x := A.B;").find());
        assertFalse(SearchPatterns.wholeWord("a.b").matcher("x := axb;").find());
        assertFalse(SearchPatterns.wholeWord("cnt").matcher("cnt2 := 1;").find());
    }

    @Test
    void invalidQueryFallsBackToLiteral() {
        assertFalse(SearchPatterns.isValidRegex("(unclosed"));
        assertTrue(SearchPatterns.userPattern("(unclosed").matcher("x (UNCLOSED y").find());
        assertTrue(SearchPatterns.userPattern("ab+").matcher("ABBB").find());
    }

    @Test
    void wordAtCursor() {
        assertEquals("counter", Identifiers.wordAt("  counter := 1;", 4));
        assertEquals("counter", Identifiers.wordAt("  counter := 1;", 9));
        assertNull(Identifiers.wordAt("  counter := 1;", 11));
        assertTrue(Identifiers.isUsableName("Motor_1"));
        assertFalse(Identifiers.isUsableName("END_IF"));
        assertFalse(Identifiers.isUsableName("dint"));
    }
}
