package com.copilot.condition;

/**
 * Node kinds of a rule condition tree.
 */
public enum ConditionType {
    // Feature vector
    FEATURE,

    // Knowledge graph
    CONNECTED,
    PATH_EXISTS,
    ATTRIBUTE,

    // Logical
    AND,
    OR,
    NOT,

    // Special
    ALWAYS_TRUE
}
