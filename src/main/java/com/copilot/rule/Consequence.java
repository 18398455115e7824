package com.copilot.rule;

import java.util.Objects;

/**
 * What a rule proposes when it fires.
 *
 * @param actionId  Id of an ACTION_TEMPLATE node in the knowledge graph
 * @param baseScore Score before the confidence multiplier is applied
 */
public record Consequence(String actionId, double baseScore) {

    public Consequence {
        Objects.requireNonNull(actionId, "Action id cannot be null");
    }
}
