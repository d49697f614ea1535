package org.shadowide.st.refactor;

import org.junit.jupiter.api.Test;
import org.shadowide.st.symbol.StReference;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenameEngineTest {

    private final RenameEngine engine = new RenameEngine();

    @Test
    void renamesDeclarationAndUsages() {
        RenameResult result = engine.rename("VAR\n X: BOOL;\nEND_VAR\nIF X THEN X:=FALSE; END_IF;", "X", "Flag");
        assertEquals(3, result.getChanges());
        assertEquals(Arrays.asList(2, 4), result.getAffectedLines());
        assertEquals("VAR\n Flag: BOOL;\nEND_VAR\nIF Flag THEN Flag:=FALSE; END_IF;", result.getContent());
        assertEquals(0, engine.rename(result.getContent(), "X", "Flag").getChanges());
    }

    @Test
    void missingNameIsNoOp() {
        String text = "VAR\n  a : INT;\nEND_VAR";
        RenameResult result = engine.rename(text, "NameNotPresent", "X");
        assertTrue(result.isNoOp());
        assertEquals(0, result.getChanges());
        assertSame(text, result.getContent());
        assertTrue(result.getAffectedLines().isEmpty());
    }

    @Test
    void matchesWholeWordsIgnoringCase() {
        RenameResult result = engine.rename("x := X + xx; // x", "x", "y");
        assertEquals("y := y + xx; // y", result.getContent());
        assertEquals(3, result.getChanges());
        assertEquals(Arrays.asList(1), result.getAffectedLines());
    }

    @Test
    void newNameIsInsertedLiterally() {
        assertEquals("a$1 := 1;", engine.rename("a := 1;", "a", "a$1").getContent());
    }

    @Test
    void nameWithRegexCharactersIsQuoted() {
        assertEquals(0, engine.rename("a := 1;", ".", "b").getChanges());
    }

    @Test
    void renameMatchingUsesRegex() {
        RenameResult result = engine.renameMatching("a1 := a2 + b1;", "a\\d", "z");
        assertEquals("z := z + b1;", result.getContent());
        assertEquals(2, result.getChanges());
    }

    @Test
    void renameMatchingFallsBackToLiteral() {
        RenameResult result = engine.renameMatching("arr[ := 1;", "arr[", "x");
        assertEquals("x := 1;", result.getContent());
        assertEquals(1, result.getChanges());
    }

    @Test
    void renameMatchingIgnoresEmptyMatches() {
        RenameResult result = engine.renameMatching("abc", "x*", "y");
        assertEquals(0, result.getChanges());
        assertEquals("abc", result.getContent());
    }

    @Test
    void findsOccurrencesWithPositions() {
        List<StReference> occurrences = engine.findOccurrences("a := 1;\nb := a + A;", "a");
        assertEquals(3, occurrences.size());
        assertEquals(new StReference(1, 0, 1), occurrences.get(0));
        assertEquals(new StReference(2, 5, 1), occurrences.get(1));
        assertEquals(new StReference(2, 9, 1), occurrences.get(2));
    }
}
