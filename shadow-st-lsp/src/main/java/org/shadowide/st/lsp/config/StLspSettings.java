package org.shadowide.st.lsp.config;

import org.shadowide.st.analysis.AnalysisOptions;
import org.shadowide.st.document.UndoRedoStack;
import org.shadowide.st.format.FormatOptions;
import org.shadowide.st.rule.ValidationRule;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Server settings, updated from {@code workspace/didChangeConfiguration}.
 */
public class StLspSettings {

    public static final long DEFAULT_DEBOUNCE_MILLIS = 1000L;

    private volatile int tabSize = FormatOptions.DEFAULT_TAB_SIZE;
    private volatile boolean insertSpaces = true;
    private volatile int maxUndoStackSize = UndoRedoStack.DEFAULT_MAX_SIZE;
    private volatile long debounceMillis = DEFAULT_DEBOUNCE_MILLIS;
    private volatile int maxLoopDepth = AnalysisOptions.DEFAULT_MAX_LOOP_DEPTH;
    private volatile Map<String, List<ValidationRule>> tagRules = Collections.emptyMap();

    public int getTabSize() {
        return tabSize;
    }

    public void setTabSize(int tabSize) {
        this.tabSize = tabSize;
    }

    public boolean isInsertSpaces() {
        return insertSpaces;
    }

    public void setInsertSpaces(boolean insertSpaces) {
        this.insertSpaces = insertSpaces;
    }

    public int getMaxUndoStackSize() {
        return maxUndoStackSize;
    }

    public void setMaxUndoStackSize(int maxUndoStackSize) {
        this.maxUndoStackSize = maxUndoStackSize;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public int getMaxLoopDepth() {
        return maxLoopDepth;
    }

    public void setMaxLoopDepth(int maxLoopDepth) {
        this.maxLoopDepth = maxLoopDepth;
    }

    public Map<String, List<ValidationRule>> getTagRules() {
        return tagRules;
    }

    public void setTagRules(Map<String, List<ValidationRule>> tagRules) {
        Map<String, List<ValidationRule>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (tagRules != null) {
            copy.putAll(tagRules);
        }
        this.tagRules = Collections.unmodifiableMap(copy);
    }

    public FormatOptions toFormatOptions() {
        return new FormatOptions(tabSize, insertSpaces);
    }

    public AnalysisOptions toAnalysisOptions() {
        return new AnalysisOptions(maxLoopDepth, tagRules);
    }

    @Override
    public String toString() {
        return "StLspSettings{tabSize=" + tabSize + ", insertSpaces=" + insertSpaces + ", maxUndoStackSize="
                + maxUndoStackSize + ", debounceMillis=" + debounceMillis + ", maxLoopDepth=" + maxLoopDepth
                + ", tagRules=" + tagRules.keySet() + "}";
    }
}
