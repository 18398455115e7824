package com.copilot.condition.impl;

import com.copilot.condition.ComparisonOperator;
import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;
import com.copilot.condition.NodeSelector;
import com.copilot.condition.ValueMatcher;
import com.copilot.graph.Node;

import java.util.List;
import java.util.Optional;

/**
 * Compares a node attribute against a literal. The node is the subject or one of its
 * selected neighbors; with several neighbors the condition holds if any of them matches.
 * A node without the attribute does not match.
 */
public class AttributeCondition implements Condition {

    private final NodeSelector selector;
    private final String attribute;
    private final ComparisonOperator operator;
    private final Object expected;
    private final List<Object> expectedValues;

    public AttributeCondition(NodeSelector selector, String attribute, ComparisonOperator operator,
                              Object expected, List<Object> expectedValues) {
        this.selector = selector;
        this.attribute = attribute;
        this.operator = operator;
        this.expected = expected;
        this.expectedValues = expectedValues == null ? List.of() : List.copyOf(expectedValues);
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        for (Node node : selector.select(context)) {
            Optional<Object> actual = node.attribute(attribute);
            if (actual.isPresent() && ValueMatcher.matches(actual.get(), operator, expected, expectedValues)) {
                trace.bind(selector.bindingPrefix() + "." + attribute, actual.get());
                return true;
            }
        }
        return false;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ATTRIBUTE;
    }

    @Override
    public String toString() {
        return "attribute(" + selector + ", " + attribute + ") " + operator.symbol() + " "
                + (operator == ComparisonOperator.IN ? expectedValues : expected);
    }
}
