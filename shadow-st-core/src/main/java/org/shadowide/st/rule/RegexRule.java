package org.shadowide.st.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The whole value, without surrounding quotes, must match the pattern. A pattern that does not compile judges
 * nothing.
 */
public class RegexRule extends ValidationRule {

    private static final Logger logger = LoggerFactory.getLogger(RegexRule.class);

    private final String pattern;
    private final Pattern compiled;

    public RegexRule(String id, String pattern, String message, RuleSeverity severity) {
        super(id, message, severity);
        this.pattern = pattern;
        this.compiled = compile(id, pattern);
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String getType() {
        return "regex";
    }

    @Override
    public RuleOutcome evaluate(String literal) {
        if (compiled == null || literal == null) {
            return RuleOutcome.NOT_APPLICABLE;
        }
        return compiled.matcher(unquote(literal.trim())).matches() ? RuleOutcome.PASS : RuleOutcome.FAIL;
    }

    @Override
    protected String defaultMessage() {
        return "Value must match pattern: " + pattern;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '\'' || first == '"') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static Pattern compile(String id, String pattern) {
        if (pattern == null) {
            return null;
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            logger.warn("Validation rule {} has an invalid pattern '{}': {}", id, pattern, e.getDescription());
            return null;
        }
    }
}
