package com.copilot.condition.impl;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;
import com.copilot.graph.Direction;
import com.copilot.graph.Node;
import com.copilot.graph.NodeType;
import com.copilot.graph.Relation;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds when the subject has at least one neighbor of {@code targetType} along {@code relation}.
 * Binds {@code connected.<relation>} to the matching neighbor ids.
 */
public class ConnectedCondition implements Condition {

    private final Relation relation;
    private final NodeType targetType;
    private final Direction direction;

    public ConnectedCondition(Relation relation, NodeType targetType, Direction direction) {
        this.relation = relation;
        this.targetType = targetType;
        this.direction = direction;
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        List<String> matching = new ArrayList<>();
        for (Node neighbor : context.graph().neighbors(context.subjectId(), relation, direction)) {
            if (neighbor.type() == targetType && !matching.contains(neighbor.id())) {
                matching.add(neighbor.id());
            }
        }
        if (matching.isEmpty()) {
            return false;
        }
        trace.bind("connected." + relation.label(), String.join(", ", matching));
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CONNECTED;
    }

    @Override
    public String toString() {
        return "connected(" + relation + ", " + targetType + (direction != Direction.OUT ? ", " + direction : "") + ")";
    }
}
