package com.copilot.engine;

/**
 * An action kept in a decision record.
 *
 * @param actionId  Action template id
 * @param score     Winning score
 * @param rationale Winning rationale, with suppression notes appended
 */
public record ScoredAction(String actionId, double score, String rationale) {
}
