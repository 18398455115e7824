package com.copilot.condition;

import java.util.List;
import java.util.Optional;

/**
 * Compares feature and attribute values against predicate literals.
 * <p>
 * Numbers compare numerically, including a number against a numeric string.
 * Everything else compares by string form. Ordering operators are false for
 * non-numeric values rather than failing.
 */
public final class ValueMatcher {

    private ValueMatcher() {
    }

    public static boolean matches(Object actual, ComparisonOperator operator, Object expected, List<Object> expectedValues) {
        if (actual == null) {
            return false;
        }
        return switch (operator) {
            case EQ -> valuesMatch(actual, expected);
            case NE -> !valuesMatch(actual, expected);
            case IN -> expectedValues.stream().anyMatch(v -> valuesMatch(actual, v));
            case LT, LE, GT, GE -> compare(actual, operator, expected);
        };
    }

    private static boolean compare(Object actual, ComparisonOperator operator, Object expected) {
        Optional<Double> left = toDouble(actual);
        Optional<Double> right = toDouble(expected);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        double a = left.get();
        double b = right.get();
        return switch (operator) {
            case LT -> a < b;
            case LE -> a <= b;
            case GT -> a > b;
            case GE -> a >= b;
            default -> throw new IllegalStateException("Not an ordering operator: " + operator);
        };
    }

    static boolean valuesMatch(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual.equals(expected)) {
            return true;
        }
        if (actual instanceof Number || expected instanceof Number) {
            Optional<Double> a = toDouble(actual);
            Optional<Double> b = toDouble(expected);
            if (a.isPresent() && b.isPresent()) {
                return a.get().doubleValue() == b.get().doubleValue();
            }
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    public static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Render a value for rationale text. Whole doubles print without a fraction.
     */
    public static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }
}
