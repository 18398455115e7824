package com.copilot.engine;

/**
 * A single rule's proposal for one subject, before aggregation.
 *
 * @param subjectId Subject the proposal is for
 * @param ruleId    Rule that fired
 * @param actionId  Proposed action template id
 * @param score     Base score times confidence multiplier
 * @param rationale Rendered explanation
 */
public record CandidateDecision(String subjectId, String ruleId, String actionId, double score, String rationale) {
}
