package com.copilot.rule;

import com.copilot.condition.Condition;

import java.util.Objects;

/**
 * A loaded, immutable decision rule.
 *
 * @param id                  Unique rule id
 * @param priority            Higher priorities are evaluated first
 * @param condition           Compiled condition tree
 * @param consequence         Proposed action and base score
 * @param explanationTemplate Rationale text with {placeholder}s for matched values
 * @param declarationIndex    Position in the source definition list, used as tie-break
 */
public record Rule(
        String id,
        int priority,
        Condition condition,
        Consequence consequence,
        String explanationTemplate,
        int declarationIndex
) {
    public Rule {
        Objects.requireNonNull(id, "Rule id cannot be null");
        Objects.requireNonNull(condition, "Rule condition cannot be null");
        Objects.requireNonNull(consequence, "Rule consequence cannot be null");
        explanationTemplate = explanationTemplate == null ? "" : explanationTemplate;
    }

    public String actionId() {
        return consequence.actionId();
    }

    @Override
    public String toString() {
        return "Rule{" + id + ", priority=" + priority + ", when " + condition
                + " then " + consequence.actionId() + "@" + consequence.baseScore() + "}";
    }
}
