package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;

/**
 * Logical NOT condition - negates the nested condition.
 * Nothing the nested condition binds is kept.
 */
public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = condition;
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        return !condition.evaluate(context, trace.child());
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
