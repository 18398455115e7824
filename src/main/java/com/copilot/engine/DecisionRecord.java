package com.copilot.engine;

import java.util.List;
import java.util.Objects;

/**
 * The aggregated outcome for one subject: ranked actions, possibly none.
 *
 * @param subjectId Subject id
 * @param actions   Actions by descending score
 */
public record DecisionRecord(String subjectId, List<ScoredAction> actions) {

    public DecisionRecord {
        Objects.requireNonNull(subjectId, "Subject id cannot be null");
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static DecisionRecord empty(String subjectId) {
        return new DecisionRecord(subjectId, List.of());
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }

    public List<String> actionIds() {
        return actions.stream().map(ScoredAction::actionId).toList();
    }
}
