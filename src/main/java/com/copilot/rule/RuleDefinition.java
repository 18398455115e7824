package com.copilot.rule;

import com.copilot.condition.ConditionConfig;

/**
 * Declarative rule as it appears in configuration.
 * Exactly one of {@code condition} and {@code conditionExpr} is expected; with neither
 * the rule is unconditional.
 *
 * @param id            Unique rule id
 * @param priority      Evaluation priority (higher first)
 * @param actionId      Action template node id
 * @param baseScore     Base score of the proposed action
 * @param explanation   Explanation template
 * @param condition     Condition tree
 * @param conditionExpr Condition as an expression string
 */
public record RuleDefinition(
        String id,
        int priority,
        String actionId,
        double baseScore,
        String explanation,
        ConditionConfig condition,
        String conditionExpr
) {
    public static RuleDefinition of(String id, int priority, String actionId, double baseScore,
                                    String explanation, ConditionConfig condition) {
        return new RuleDefinition(id, priority, actionId, baseScore, explanation, condition, null);
    }

    public static RuleDefinition expr(String id, int priority, String actionId, double baseScore,
                                      String explanation, String conditionExpr) {
        return new RuleDefinition(id, priority, actionId, baseScore, explanation, null, conditionExpr);
    }
}
