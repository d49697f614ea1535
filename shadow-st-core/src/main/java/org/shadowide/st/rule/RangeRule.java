package org.shadowide.st.rule;

import org.apache.commons.lang3.Validate;

/**
 * Inclusive bounds.
 */
public class RangeRule extends ValidationRule {

    private final double min;
    private final double max;

    public RangeRule(String id, double min, double max, String message, RuleSeverity severity) {
        super(id, message, severity);
        Validate.isTrue(min <= max, "range min %s is greater than max %s", min, max);
        this.min = min;
        this.max = max;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String getType() {
        return "range";
    }

    @Override
    public RuleOutcome evaluate(String literal) {
        Double value = parseNumber(literal);
        if (value == null) {
            return RuleOutcome.NOT_APPLICABLE;
        }
        return value >= min && value <= max ? RuleOutcome.PASS : RuleOutcome.FAIL;
    }

    @Override
    protected String defaultMessage() {
        return "Value must be between " + formatNumber(min) + " and " + formatNumber(max);
    }
}
