package com.copilot.rule;

import com.copilot.condition.Condition;
import com.copilot.condition.ConditionConfig;
import com.copilot.condition.ConditionFactory;
import com.copilot.config.ConditionExpressionParser;
import com.copilot.exception.ConfigurationException;
import com.copilot.exception.RuleValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns rule definitions into loaded rules, compiling their conditions.
 * Any problem is reported as a {@link RuleValidationException} naming the rule.
 */
public class RuleFactory {

    private final ConditionFactory conditionFactory;

    public RuleFactory() {
        this(new ConditionFactory());
    }

    public RuleFactory(ConditionFactory conditionFactory) {
        this.conditionFactory = conditionFactory;
    }

    /**
     * Compile definitions in order; the list position becomes the declaration index.
     */
    public List<Rule> create(List<RuleDefinition> definitions) {
        List<Rule> rules = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            rules.add(create(definitions.get(i), i));
        }
        return rules;
    }

    public Rule create(RuleDefinition definition, int declarationIndex) {
        String ruleId = definition.id();
        if (ruleId == null || ruleId.isBlank()) {
            throw new RuleValidationException("#" + declarationIndex, "rule requires an id");
        }
        if (definition.actionId() == null || definition.actionId().isBlank()) {
            throw new RuleValidationException(ruleId, "rule requires an action");
        }
        if (Double.isNaN(definition.baseScore()) || Double.isInfinite(definition.baseScore())
                || definition.baseScore() < 0) {
            throw new RuleValidationException(ruleId, "score must be a finite non-negative number, got "
                    + definition.baseScore());
        }
        if (definition.condition() != null && definition.conditionExpr() != null) {
            throw new RuleValidationException(ruleId, "rule has both condition and condition-expr");
        }

        Condition condition;
        try {
            ConditionConfig config = definition.conditionExpr() != null
                    ? ConditionExpressionParser.parse(definition.conditionExpr())
                    : definition.condition() != null ? definition.condition() : ConditionConfig.alwaysTrue();
            condition = conditionFactory.create(config);
        } catch (RuleValidationException e) {
            throw e;
        } catch (ConfigurationException e) {
            throw new RuleValidationException(ruleId, e.getMessage(), e);
        }

        return new Rule(ruleId, definition.priority(), condition,
                new Consequence(definition.actionId(), definition.baseScore()),
                definition.explanation(), declarationIndex);
    }
}
