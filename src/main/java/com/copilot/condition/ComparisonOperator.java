package com.copilot.condition;

import java.util.Locale;

/**
 * Operators of feature and attribute predicates.
 */
public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("IN");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether the operator orders values and therefore needs a numeric literal.
     */
    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    /**
     * Parse an operator from its symbol ("=", "==", "!=", "<>", "<", "<=", ">", ">=")
     * or its name ("eq", "ge", "in", ...).
     *
     * @throws IllegalArgumentException for unknown operators
     */
    public static ComparisonOperator parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Operator cannot be blank");
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "=", "==", "EQ", "EQUALS" -> EQ;
            case "!=", "<>", "≠", "NE", "NOT_EQUALS" -> NE;
            case "<", "LT" -> LT;
            case "<=", "≤", "LE" -> LE;
            case ">", "GT" -> GT;
            case ">=", "≥", "GE" -> GE;
            case "IN" -> IN;
            default -> throw new IllegalArgumentException("Unknown operator '" + text + "'");
        };
    }
}
