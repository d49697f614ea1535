package org.shadowide.st.analysis;

import org.apache.commons.lang3.Validate;
import org.shadowide.st.rule.ValidationRule;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Limits and tag rules used by {@link SemanticAnalyzer}.
 */
public final class AnalysisOptions {

    public static final int DEFAULT_MAX_LOOP_DEPTH = 2;

    private final int maxLoopDepth;
    private final Map<String, List<ValidationRule>> tagRules;

    public AnalysisOptions(int maxLoopDepth, Map<String, List<ValidationRule>> tagRules) {
        Validate.isTrue(maxLoopDepth >= 1, "maxLoopDepth must be at least 1, got %d", maxLoopDepth);
        this.maxLoopDepth = maxLoopDepth;
        Map<String, List<ValidationRule>> rules = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (tagRules != null) {
            rules.putAll(tagRules);
        }
        this.tagRules = Collections.unmodifiableMap(rules);
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_MAX_LOOP_DEPTH, null);
    }

    public int getMaxLoopDepth() {
        return maxLoopDepth;
    }

    public List<ValidationRule> rulesFor(String tagName) {
        List<ValidationRule> rules = tagRules.get(tagName);
        return rules == null ? Collections.<ValidationRule>emptyList() : rules;
    }

    public Map<String, List<ValidationRule>> getTagRules() {
        return tagRules;
    }
}
