package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;

import java.util.List;

/**
 * Logical AND condition - all nested conditions must be true.
 * Evaluates left to right and stops at the first false.
 */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        MatchTrace scratch = trace.child();
        for (Condition condition : conditions) {
            if (!condition.evaluate(context, scratch)) {
                return false;
            }
        }
        trace.merge(scratch);
        return true;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return "AND" + conditions;
    }
}
