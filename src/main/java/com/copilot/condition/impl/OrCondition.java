package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;
import com.copilot.exception.MissingFeatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logical OR condition - at least one nested condition must be true.
 * Evaluates left to right and stops at the first true.
 * A branch reading a missing feature counts as false and the next branch is still tried.
 * If every branch reads a missing feature the first such exception is rethrown.
 */
public class OrCondition implements Condition {

    private static final Logger log = LoggerFactory.getLogger(OrCondition.class);

    private final List<Condition> conditions;

    public OrCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        MissingFeatureException missing = null;
        boolean anyEvaluated = false;
        for (Condition condition : conditions) {
            MatchTrace scratch = trace.child();
            try {
                if (condition.evaluate(context, scratch)) {
                    trace.merge(scratch);
                    return true;
                }
                anyEvaluated = true;
            } catch (MissingFeatureException e) {
                log.trace("OR branch unmatched for subject {}: missing feature '{}'",
                        context.subjectId(), e.getFeature());
                if (missing == null) {
                    missing = e;
                }
            }
        }
        if (!anyEvaluated && missing != null) {
            throw missing;
        }
        return false;
    }

    /**
     * Branches in declaration order.
     */
    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.OR;
    }

    @Override
    public String toString() {
        return "OR" + conditions;
    }
}
