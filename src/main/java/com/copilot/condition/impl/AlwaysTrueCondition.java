package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;

/**
 * Condition that always matches. Used for unconditional rules.
 */
public final class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "TRUE";
    }
}
