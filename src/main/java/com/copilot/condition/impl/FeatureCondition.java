package com.copilot.condition.impl;

import com.copilot.condition.ComparisonOperator;
import com.copilot.condition.Condition;
import com.copilot.condition.ConditionType;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;
import com.copilot.condition.ValueMatcher;
import com.copilot.exception.MissingFeatureException;

import java.util.List;

/**
 * Compares a feature of the subject's vector against a literal or literal set.
 * An absent feature is an error, not a false value: the evaluator decides how to recover.
 */
public class FeatureCondition implements Condition {

    private final String feature;
    private final ComparisonOperator operator;
    private final Object expected;
    private final List<Object> expectedValues;

    public FeatureCondition(String feature, ComparisonOperator operator, Object expected, List<Object> expectedValues) {
        this.feature = feature;
        this.operator = operator;
        this.expected = expected;
        this.expectedValues = expectedValues == null ? List.of() : List.copyOf(expectedValues);
    }

    @Override
    public boolean evaluate(EvaluationContext context, MatchTrace trace) {
        Object actual = context.features().get(feature)
                .orElseThrow(() -> new MissingFeatureException(context.subjectId(), feature));

        boolean matched = ValueMatcher.matches(actual, operator, expected, expectedValues);
        if (matched) {
            trace.bind(feature, actual);
        }
        return matched;
    }

    public String getFeature() {
        return feature;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FEATURE;
    }

    @Override
    public String toString() {
        return feature + " " + operator.symbol() + " " + (operator == ComparisonOperator.IN ? expectedValues : expected);
    }
}
