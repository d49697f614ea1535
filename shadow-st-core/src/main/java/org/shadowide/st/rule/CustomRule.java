package org.shadowide.st.rule;

/**
 * Script evaluated by the runtime. Kept for round-tripping; never judged locally.
 */
public class CustomRule extends ValidationRule {

    private final String expression;

    public CustomRule(String id, String expression, String message, RuleSeverity severity) {
        super(id, message, severity);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String getType() {
        return "custom";
    }

    @Override
    public RuleOutcome evaluate(String literal) {
        return RuleOutcome.NOT_APPLICABLE;
    }

    @Override
    protected String defaultMessage() {
        return "Custom validation failed";
    }
}
