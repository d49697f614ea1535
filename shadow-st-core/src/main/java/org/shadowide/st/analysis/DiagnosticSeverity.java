package org.shadowide.st.analysis;

import org.shadowide.st.rule.RuleSeverity;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO,
    HINT;

    public static DiagnosticSeverity of(RuleSeverity severity) {
        switch (severity) {
            case WARNING:
                return WARNING;
            case INFO:
                return INFO;
            default:
                return ERROR;
        }
    }
}
