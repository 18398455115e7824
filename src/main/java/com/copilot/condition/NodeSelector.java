package com.copilot.condition;

import com.copilot.graph.Direction;
import com.copilot.graph.Node;
import com.copilot.graph.NodeType;
import com.copilot.graph.Relation;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the node(s) an attribute predicate reads: the subject itself, or the
 * subject's neighbors along a relation, optionally restricted to a node type.
 */
public final class NodeSelector {

    private final Relation relation;
    private final Direction direction;
    private final NodeType type;

    private NodeSelector(Relation relation, Direction direction, NodeType type) {
        this.relation = relation;
        this.direction = direction;
        this.type = type;
    }

    public static NodeSelector subject() {
        return new NodeSelector(null, null, null);
    }

    public static NodeSelector neighbors(Relation relation, Direction direction, NodeType type) {
        return new NodeSelector(relation, direction == null ? Direction.OUT : direction, type);
    }

    public boolean isSubject() {
        return relation == null;
    }

    public List<Node> select(EvaluationContext context) {
        if (isSubject()) {
            return context.graph().node(context.subjectId()).map(List::of).orElse(List.of());
        }
        List<Node> selected = new ArrayList<>();
        for (Node node : context.graph().neighbors(context.subjectId(), relation, direction)) {
            if (type == null || node.type() == type) {
                selected.add(node);
            }
        }
        return selected;
    }

    /**
     * Prefix of placeholder names bound by predicates using this selector.
     */
    public String bindingPrefix() {
        return isSubject() ? GraphSelector.SUBJECT : relation.label();
    }

    @Override
    public String toString() {
        if (isSubject()) {
            return GraphSelector.SUBJECT;
        }
        return relation + (direction != Direction.OUT ? ":" + direction : "") + (type != null ? ":" + type : "");
    }
}
