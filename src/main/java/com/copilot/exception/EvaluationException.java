package com.copilot.exception;

/**
 * Exception thrown when evaluating a subject fails for a reason other than a missing feature.
 * Fatal to the run.
 */
public class EvaluationException extends CopilotException {

    private final String subjectId;

    public EvaluationException(String subjectId, String message, Throwable cause) {
        super("Evaluation failed for subject '" + subjectId + "': " + message, cause);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
