package com.copilot.condition;

import java.util.List;

/**
 * Declarative configuration of a condition tree node.
 *
 * @param type       Condition type (FEATURE, CONNECTED, AND, etc.)
 * @param field      Feature name for FEATURE, attribute name for ATTRIBUTE
 * @param operator   Operator symbol or name for FEATURE and ATTRIBUTE
 * @param value      Literal for comparison operators
 * @param values     Literal set for IN
 * @param graph      Graph references for CONNECTED, PATH_EXISTS and ATTRIBUTE
 * @param conditions Nested conditions for AND/OR/NOT
 */
public record ConditionConfig(
        ConditionType type,
        String field,
        String operator,
        Object value,
        List<Object> values,
        GraphSelector graph,
        List<ConditionConfig> conditions
) {
    public static ConditionConfig alwaysTrue() {
        return new ConditionConfig(ConditionType.ALWAYS_TRUE, null, null, null, null, null, null);
    }

    public static ConditionConfig feature(String feature, String operator, Object value) {
        return new ConditionConfig(ConditionType.FEATURE, feature, operator, value, null, null, null);
    }

    public static ConditionConfig featureIn(String feature, List<Object> values) {
        return new ConditionConfig(ConditionType.FEATURE, feature, "IN", null, values, null, null);
    }

    public static ConditionConfig connected(String relation, String targetType) {
        return new ConditionConfig(ConditionType.CONNECTED, null, null, null, null,
                GraphSelector.connected(relation, targetType), null);
    }

    public static ConditionConfig connected(String relation, String targetType, String direction) {
        return new ConditionConfig(ConditionType.CONNECTED, null, null, null, null,
                GraphSelector.neighbors(relation, direction, targetType), null);
    }

    public static ConditionConfig pathExists(String targetId, int maxHops) {
        return new ConditionConfig(ConditionType.PATH_EXISTS, null, null, null, null,
                GraphSelector.path(targetId, maxHops), null);
    }

    public static ConditionConfig attribute(GraphSelector nodeRef, String name, String operator, Object value) {
        return new ConditionConfig(ConditionType.ATTRIBUTE, name, operator, value, null, nodeRef, null);
    }

    public static ConditionConfig attributeIn(GraphSelector nodeRef, String name, List<Object> values) {
        return new ConditionConfig(ConditionType.ATTRIBUTE, name, "IN", null, values, nodeRef, null);
    }

    public static ConditionConfig and(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.AND, null, null, null, null, null, conditions);
    }

    public static ConditionConfig or(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.OR, null, null, null, null, null, conditions);
    }

    public static ConditionConfig not(ConditionConfig condition) {
        return new ConditionConfig(ConditionType.NOT, null, null, null, null, null, List.of(condition));
    }
}
