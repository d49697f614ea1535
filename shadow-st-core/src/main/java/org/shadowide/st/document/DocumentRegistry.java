package org.shadowide.st.document;

import org.apache.commons.lang3.Validate;
import org.shadowide.st.diff.DiffChange;
import org.shadowide.st.diff.DiffEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open documents by id, each with its own undo and redo history.
 * <p>
 * Operations on one document are serialized; different documents never share state.
 */
public class DocumentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DocumentRegistry.class);

    private static final class Session {
        final StDocument document;
        final UndoRedoStack history;

        Session(StDocument document, UndoRedoStack history) {
            this.document = document;
            this.history = history;
        }
    }

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final DiffEngine diffEngine;
    private volatile int maxUndoStackSize;

    public DocumentRegistry() {
        this(UndoRedoStack.DEFAULT_MAX_SIZE);
    }

    public DocumentRegistry(int maxUndoStackSize) {
        this(maxUndoStackSize, new DiffEngine());
    }

    public DocumentRegistry(int maxUndoStackSize, DiffEngine diffEngine) {
        Validate.isTrue(maxUndoStackSize >= 1, "maxUndoStackSize must be at least 1, got %d", maxUndoStackSize);
        this.maxUndoStackSize = maxUndoStackSize;
        this.diffEngine = diffEngine;
    }

    /**
     * Opens a clean document. Reopening an id starts a fresh history.
     */
    public StDocument open(String id, String savedText) {
        Validate.notNull(id, "id");
        Session session = new Session(new StDocument(id, savedText), new UndoRedoStack(maxUndoStackSize));
        if (sessions.put(id, session) != null) {
            logger.info("Document {} reopened, previous history discarded", id);
        } else {
            logger.info("Document {} opened", id);
        }
        return session.document;
    }

    public boolean isOpen(String id) {
        return id != null && sessions.containsKey(id);
    }

    public StDocument get(String id) {
        return session(id).document;
    }

    public String getCurrentText(String id) {
        Session session = session(id);
        synchronized (session) {
            return session.document.getCurrentText();
        }
    }

    /**
     * Applies a user edit. Text equal to the current text is ignored.
     *
     * @return whether the document changed
     */
    public boolean edit(String id, String newContent) {
        Validate.notNull(newContent, "newContent");
        Session session = session(id);
        synchronized (session) {
            String current = session.document.getCurrentText();
            if (current.equals(newContent)) {
                return false;
            }
            session.history.recordEdit(current);
            session.document.setWorkingText(newContent);
            return true;
        }
    }

    /**
     * @return the restored text, or {@code null} when there was nothing to undo
     */
    public String undo(String id) {
        Session session = session(id);
        synchronized (session) {
            String restored = session.history.undo(session.document.getCurrentText());
            if (restored != null) {
                session.document.setWorkingText(restored);
            }
            return restored;
        }
    }

    /**
     * @return the restored text, or {@code null} when there was nothing to redo
     */
    public String redo(String id) {
        Session session = session(id);
        synchronized (session) {
            String restored = session.history.redo(session.document.getCurrentText());
            if (restored != null) {
                session.document.setWorkingText(restored);
            }
            return restored;
        }
    }

    public boolean canUndo(String id) {
        Session session = session(id);
        synchronized (session) {
            return session.history.canUndo();
        }
    }

    public boolean canRedo(String id) {
        Session session = session(id);
        synchronized (session) {
            return session.history.canRedo();
        }
    }

    public int getUndoSize(String id) {
        Session session = session(id);
        synchronized (session) {
            return session.history.getUndoSize();
        }
    }

    /**
     * Promotes the working text to saved. History is kept.
     */
    public void markSaved(String id) {
        Session session = session(id);
        synchronized (session) {
            session.document.markSaved();
        }
        logger.debug("Document {} saved", id);
    }

    /**
     * Replaces the saved text with content persisted elsewhere, e.g. a save that carried text.
     */
    public void markSaved(String id, String savedText) {
        Session session = session(id);
        synchronized (session) {
            session.document.setWorkingText(savedText);
            session.document.markSaved();
        }
    }

    /**
     * Drops all unsaved changes as one undoable edit.
     *
     * @return whether there was anything to drop
     */
    public boolean revert(String id) {
        return edit(id, get(id).getSavedText());
    }

    public void close(String id) {
        if (sessions.remove(id) != null) {
            logger.info("Document {} closed", id);
        }
    }

    /**
     * Saved against working text. Empty while the document is clean.
     */
    public List<DiffChange> diff(String id) {
        Session session = session(id);
        String saved;
        String working;
        synchronized (session) {
            saved = session.document.getSavedText();
            working = session.document.getWorkingText();
        }
        if (working == null || working.equals(saved)) {
            return Collections.emptyList();
        }
        return diffEngine.diff(saved, working);
    }

    public List<String> getDocumentIds() {
        return new ArrayList<>(sessions.keySet());
    }

    public int getMaxUndoStackSize() {
        return maxUndoStackSize;
    }

    /**
     * Applies to documents opened afterwards.
     */
    public void setMaxUndoStackSize(int maxUndoStackSize) {
        Validate.isTrue(maxUndoStackSize >= 1, "maxUndoStackSize must be at least 1, got %d", maxUndoStackSize);
        this.maxUndoStackSize = maxUndoStackSize;
    }

    private Session session(String id) {
        Session session = id == null ? null : sessions.get(id);
        Validate.isTrue(session != null, "Document %s is not open", id);
        return session;
    }
}
