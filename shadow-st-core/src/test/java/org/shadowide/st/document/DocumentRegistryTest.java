package org.shadowide.st.document;

import org.junit.jupiter.api.Test;
import org.shadowide.st.diff.ChangeType;
import org.shadowide.st.diff.DiffChange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRegistryTest {

    @Test
    void undoRestoresTextBeforeLastEdit() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "a");
        registry.edit("main", "b");
        registry.edit("main", "c");
        assertEquals("b", registry.undo("main"));
        assertEquals("b", registry.getCurrentText("main"));
        assertEquals("c", registry.redo("main"));
        assertEquals("c", registry.getCurrentText("main"));
    }

    @Test
    void undoStackIsBounded() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "");
        for (int i = 0; i < 60; i++) {
            registry.edit("main", "text " + i);
        }
        assertEquals(50, registry.getUndoSize("main"));
    }

    @Test
    void sameTextIsNotAnEdit() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "a");
        assertFalse(registry.edit("main", "a"));
        assertFalse(registry.canUndo("main"));
        assertNull(registry.undo("main"));
    }

    @Test
    void undoingBackToSavedTextIsClean() {
        DocumentRegistry registry = new DocumentRegistry();
        StDocument document = registry.open("main", "a");
        registry.edit("main", "b");
        assertTrue(document.isDirty());
        assertEquals("b", document.getWorkingText());
        registry.undo("main");
        assertFalse(document.isDirty());
        assertNull(document.getWorkingText());
        assertTrue(registry.diff("main").isEmpty());
    }

    @Test
    void documentsHaveSeparateHistories() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("one", "1");
        registry.open("two", "2");
        registry.edit("one", "1b");
        assertFalse(registry.canUndo("two"));
        assertNull(registry.undo("two"));
        assertEquals("1", registry.undo("one"));
        assertEquals("2", registry.getCurrentText("two"));
    }

    @Test
    void diffComparesSavedWithWorking() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "a\nb");
        registry.edit("main", "a\nc");
        List<DiffChange> changes = registry.diff("main");
        assertEquals(2, changes.size());
        assertEquals(ChangeType.MODIFIED, changes.get(1).getType());
    }

    @Test
    void markSavedPromotesWorkingText() {
        DocumentRegistry registry = new DocumentRegistry();
        StDocument document = registry.open("main", "a");
        registry.edit("main", "b");
        registry.markSaved("main");
        assertEquals("b", document.getSavedText());
        assertFalse(document.isDirty());
        assertTrue(registry.canUndo("main"));
    }

    @Test
    void revertIsUndoable() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "a");
        registry.edit("main", "b");
        assertTrue(registry.revert("main"));
        assertEquals("a", registry.getCurrentText("main"));
        assertEquals("b", registry.undo("main"));
    }

    @Test
    void closedDocumentIsGone() {
        DocumentRegistry registry = new DocumentRegistry();
        registry.open("main", "a");
        registry.close("main");
        assertFalse(registry.isOpen("main"));
        assertThrows(IllegalArgumentException.class, () -> registry.edit("main", "b"));
    }

    @Test
    void configuredStackSizeAppliesToNewDocuments() {
        DocumentRegistry registry = new DocumentRegistry(2);
        registry.open("main", "");
        registry.edit("main", "1");
        registry.edit("main", "2");
        registry.edit("main", "3");
        assertEquals(2, registry.getUndoSize("main"));
    }
}
