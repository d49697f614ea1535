package org.shadowide.st.rule;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A constraint on the value of a tag. One subclass per rule type; the JSON form is
 * {@code {id, type, value, message, severity}}, see {@link ValidationRuleAdapter}.
 */
public abstract class ValidationRule {

    private static final Pattern TYPED_LITERAL = Pattern.compile("^[A-Za-z_]+#(.+)$");

    private static final Pattern RADIX_LITERAL = Pattern.compile("^(2|8|16)#([0-9A-Fa-f_]+)$");

    private final String id;
    private final String message;
    private final RuleSeverity severity;

    protected ValidationRule(String id, String message, RuleSeverity severity) {
        this.id = id;
        this.message = StringUtils.trimToNull(message);
        this.severity = severity == null ? RuleSeverity.ERROR : severity;
    }

    /**
     * Discriminator used in the JSON form, e.g. {@code range}.
     */
    public abstract String getType();

    public abstract RuleOutcome evaluate(String literal);

    protected abstract String defaultMessage();

    public String getId() {
        return id;
    }

    /**
     * Configured message, or the default message of the rule type.
     */
    public String getMessage() {
        return message != null ? message : defaultMessage();
    }

    /**
     * Configured message only; {@code null} when the default applies.
     */
    public String getConfiguredMessage() {
        return message;
    }

    public RuleSeverity getSeverity() {
        return severity;
    }

    /**
     * Numeric value of a Structured Text literal: plain and signed decimals, {@code 16#FF} style radix literals and
     * typed literals such as {@code INT#5}. Anything else yields {@code null}.
     */
    protected static Double parseNumber(String literal) {
        if (literal == null) {
            return null;
        }
        String value = literal.trim().replace("_", "");
        Matcher typed = TYPED_LITERAL.matcher(value);
        if (typed.matches()) {
            value = typed.group(1);
        }
        Matcher radix = RADIX_LITERAL.matcher(value);
        if (radix.matches()) {
            try {
                return (double) Long.parseLong(radix.group(2), Integer.parseInt(radix.group(1)));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * {@code 5} rather than {@code 5.0} for whole numbers.
     */
    protected static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return getType() + "{" + getMessage() + ", " + severity.getId() + '}';
    }
}
