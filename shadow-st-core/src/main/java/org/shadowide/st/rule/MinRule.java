package org.shadowide.st.rule;

public class MinRule extends ValidationRule {

    private final double min;

    public MinRule(String id, double min, String message, RuleSeverity severity) {
        super(id, message, severity);
        this.min = min;
    }

    public double getMin() {
        return min;
    }

    @Override
    public String getType() {
        return "min";
    }

    @Override
    public RuleOutcome evaluate(String literal) {
        Double value = parseNumber(literal);
        if (value == null) {
            return RuleOutcome.NOT_APPLICABLE;
        }
        return value >= min ? RuleOutcome.PASS : RuleOutcome.FAIL;
    }

    @Override
    protected String defaultMessage() {
        return "Value must be at least " + formatNumber(min);
    }
}
