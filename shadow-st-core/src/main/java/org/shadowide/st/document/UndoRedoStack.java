package org.shadowide.st.document;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded full-text history of one document. When the undo side grows past {@link #getMaxSize()} the oldest
 * snapshot is dropped.
 */
public class UndoRedoStack {

    public static final int DEFAULT_MAX_SIZE = 50;

    private final int maxSize;
    private final Deque<String> undoStack = new ArrayDeque<>();
    private final Deque<String> redoStack = new ArrayDeque<>();

    public UndoRedoStack() {
        this(DEFAULT_MAX_SIZE);
    }

    public UndoRedoStack(int maxSize) {
        Validate.isTrue(maxSize >= 1, "maxSize must be at least 1, got %d", maxSize);
        this.maxSize = maxSize;
    }

    /**
     * Records the text as it was before a user edit. Clears the redo side.
     */
    public void recordEdit(String preEditText) {
        pushUndo(preEditText);
        redoStack.clear();
    }

    /**
     * @return the text to restore, or {@code null} when there is nothing to undo
     */
    public String undo(String currentText) {
        if (undoStack.isEmpty()) {
            return null;
        }
        String previous = undoStack.removeLast();
        redoStack.addLast(currentText);
        return previous;
    }

    /**
     * @return the text to restore, or {@code null} when there is nothing to redo
     */
    public String redo(String currentText) {
        if (redoStack.isEmpty()) {
            return null;
        }
        String next = redoStack.removeLast();
        pushUndo(currentText);
        return next;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoSize() {
        return undoStack.size();
    }

    public int getRedoSize() {
        return redoStack.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    private void pushUndo(String text) {
        undoStack.addLast(text);
        while (undoStack.size() > maxSize) {
            undoStack.removeFirst();
        }
    }
}
