package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;

import java.util.OptionalInt;

/**
 * Holds when {@code targetId} is reachable from the subject within {@code maxHops} outgoing hops.
 * Binds {@code path.<targetId>} to the hop count.
 */
public class PathExistsCondition implements Condition {

    private final String targetId;
    private final int maxHops;

    public PathExistsCondition(String targetId, int maxHops) {
        this.targetId = targetId;
        this.maxHops = maxHops;
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        OptionalInt hops = context.graph().hopDistance(context.subjectId(), targetId, maxHops);
        if (hops.isEmpty()) {
            return false;
        }
        trace.bind("path." + targetId, hops.getAsInt());
        return true;
    }

    public String getTargetId() {
        return targetId;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PATH_EXISTS;
    }

    @Override
    public String toString() {
        return "path_exists(" + targetId + ", " + maxHops + ")";
    }
}
