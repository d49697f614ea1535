package org.shadowide.st.diff;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    private final DiffEngine engine = new DiffEngine();

    @Test
    void identicalTextsAreUnchanged() {
        String text = "PROGRAM p\n  x := 1;\nEND_PROGRAM";
        List<DiffChange> changes = engine.diff(text, text);
        assertEquals(3, changes.size());
        for (DiffChange change : changes) {
            assertEquals(ChangeType.UNCHANGED, change.getType());
        }
        assertEquals("same-0", changes.get(0).getChangeId());
        assertEquals("same-2", changes.get(2).getChangeId());
    }

    @Test
    void oneEntryPerLineOfLongerText() {
        assertEquals(5, engine.diff("a\nb", "a\nb\nc\nd\ne").size());
        assertEquals(4, engine.diff("a\nb\nc\nd", "a").size());
        assertEquals(1, engine.diff("", "").size());
    }

    @Test
    void classifiesByPosition() {
        List<DiffChange> changes = engine.diff("a\nb\nc", "a\nB\nc\nd");
        assertEquals(ChangeType.UNCHANGED, changes.get(0).getType());

        DiffChange modified = changes.get(1);
        assertEquals(ChangeType.MODIFIED, modified.getType());
        assertEquals("modify-0", modified.getChangeId());
        assertEquals(Integer.valueOf(2), modified.getOriginalLine());
        assertEquals("b", modified.getOriginalText());
        assertEquals("B", modified.getModifiedText());

        DiffChange added = changes.get(3);
        assertEquals(ChangeType.ADDED, added.getType());
        assertEquals("add-0", added.getChangeId());
        assertNull(added.getOriginalLine());
        assertEquals(Integer.valueOf(4), added.getModifiedLine());
        assertEquals("d", added.getModifiedText());
    }

    @Test
    void removedLinesKeepOriginalText() {
        DiffChange removed = engine.diff("a\nb\nc", "a").get(2);
        assertEquals(ChangeType.REMOVED, removed.getType());
        assertEquals("remove-1", removed.getChangeId());
        assertEquals(Integer.valueOf(3), removed.getOriginalLine());
        assertNull(removed.getModifiedLine());
        assertEquals("c", removed.getOriginalText());
    }

    @Test
    void insertionCascadesIntoModifications() {
        List<DiffChange> changes = engine.diff("a\nb", "x\na\nb");
        assertEquals(ChangeType.MODIFIED, changes.get(0).getType());
        assertEquals(ChangeType.MODIFIED, changes.get(1).getType());
        assertEquals(ChangeType.ADDED, changes.get(2).getType());
        assertEquals(3, engine.countChanges("a\nb", "x\na\nb"));
    }

    @Test
    void rejectRestoresModifiedLine() {
        DiffChange change = engine.diff("a\nb", "a\nB").get(1);
        assertEquals("a\nb", engine.reject("a\nB", change));
    }

    @Test
    void rejectRemovesAddedLine() {
        DiffChange change = engine.diff("a", "a\nb").get(1);
        assertEquals("a", engine.reject("a\nb", change));
    }

    @Test
    void rejectReinsertsRemovedLine() {
        DiffChange change = engine.diff("a\nb\nc", "a\nb").get(2);
        assertEquals("a\nb\nc", engine.reject("a\nb", change));
    }

    @Test
    void rejectOfStaleChangeLeavesTextAlone() {
        DiffChange change = engine.diff("a\nb", "a\nB").get(1);
        assertEquals("a\nC", engine.reject("a\nC", change));
        DiffChange unchanged = engine.diff("a", "a").get(0);
        assertEquals("a", engine.reject("a", unchanged));
    }
}
