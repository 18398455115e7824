package com.copilot.exception;

/**
 * Exception thrown when a rule definition is malformed: duplicate id, unknown
 * relation or node type, literal of the wrong kind for its operator, or a
 * consequence pointing at something that is not an action template.
 */
public class RuleValidationException extends ConfigurationException {

    private final String ruleId;

    public RuleValidationException(String ruleId, String message) {
        super("Rule '" + ruleId + "': " + message);
        this.ruleId = ruleId;
    }

    public RuleValidationException(String ruleId, String message, Throwable cause) {
        super("Rule '" + ruleId + "': " + message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
