package com.copilot.condition;

/**
 * A compiled boolean condition, evaluated against one subject.
 * Implementations are immutable and safe to share between threads.
 */
public interface Condition {

    /**
     * Evaluate this condition for the subject in {@code context}.
     *
     * @param context Subject, feature vector and knowledge graph
     * @param trace   Receives the values that made predicates true
     * @return true if the condition holds
     * @throws com.copilot.exception.MissingFeatureException if a referenced feature is absent
     */
    boolean evaluate(EvaluationContext context, MatchTrace trace);

    ConditionType getType();
}
