package com.copilot.exception;

/**
 * Thrown when a feature predicate references a feature the subject's vector does not carry.
 * Recovered per rule by the evaluator: the rule's condition is treated as false.
 */
public class MissingFeatureException extends CopilotException {

    private final String subjectId;
    private final String feature;

    public MissingFeatureException(String subjectId, String feature) {
        super("Subject '" + subjectId + "' has no feature '" + feature + "'");
        this.subjectId = subjectId;
        this.feature = feature;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getFeature() {
        return feature;
    }
}
