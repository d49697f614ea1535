package org.shadowide.st.rule;

import java.util.Locale;

public enum RuleSeverity {
    ERROR,
    WARNING,
    INFO;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing ids map to {@link #ERROR}.
     */
    public static RuleSeverity fromId(String id) {
        if (id != null) {
            for (RuleSeverity severity : values()) {
                if (severity.getId().equalsIgnoreCase(id.trim())) {
                    return severity;
                }
            }
        }
        return ERROR;
    }
}
