package org.shadowide.st.rule;

public class MaxRule extends ValidationRule {

    private final double max;

    public MaxRule(String id, double max, String message, RuleSeverity severity) {
        super(id, message, severity);
        this.max = max;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String getType() {
        return "max";
    }

    @Override
    public RuleOutcome evaluate(String literal) {
        Double value = parseNumber(literal);
        if (value == null) {
            return RuleOutcome.NOT_APPLICABLE;
        }
        return value <= max ? RuleOutcome.PASS : RuleOutcome.FAIL;
    }

    @Override
    protected String defaultMessage() {
        return "Value must not exceed " + formatNumber(max);
    }
}
