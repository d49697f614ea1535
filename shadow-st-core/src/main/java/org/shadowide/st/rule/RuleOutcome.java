package org.shadowide.st.rule;

public enum RuleOutcome {
    PASS,
    FAIL,
    /** The value is not something this rule can judge locally, e.g. a non-numeric literal for a range rule. */
    NOT_APPLICABLE
}
