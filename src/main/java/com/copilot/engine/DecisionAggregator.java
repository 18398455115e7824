package com.copilot.engine;

import com.copilot.config.AggregationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds one subject's candidate decisions into a decision record.
 * <ol>
 *   <li>Candidates are grouped by action; a group scores its maximum candidate
 *       (ties go to the lowest rule id), whose rationale it keeps.</li>
 *   <li>Groups are ranked by score descending, then action id ascending.</li>
 *   <li>Groups below {@code minScore} are dropped, then the ranking is cut to {@code topK}.</li>
 *   <li>Walking the ranking, an action mutually exclusive with one already kept is dropped
 *       and the kept action's rationale notes the suppression.</li>
 * </ol>
 */
public class DecisionAggregator {

    private static final Logger log = LoggerFactory.getLogger(DecisionAggregator.class);

    static final Comparator<CandidateDecision> RANKING = Comparator
            .comparingDouble(CandidateDecision::score).reversed()
            .thenComparing(CandidateDecision::actionId);

    private final AggregationConfig config;

    public DecisionAggregator(AggregationConfig config) {
        this.config = Objects.requireNonNull(config, "Aggregation config cannot be null");
    }

    public DecisionRecord aggregate(String subjectId, List<CandidateDecision> candidates) {
        Map<String, CandidateDecision> winners = new LinkedHashMap<>();
        for (CandidateDecision candidate : candidates) {
            winners.merge(candidate.actionId(), candidate, DecisionAggregator::stronger);
        }

        List<CandidateDecision> ranked = new ArrayList<>(winners.values());
        ranked.sort(RANKING);
        ranked.removeIf(c -> c.score() < config.minScore());
        if (ranked.size() > config.topK()) {
            ranked = ranked.subList(0, config.topK());
        }

        List<CandidateDecision> kept = new ArrayList<>();
        List<StringBuilder> rationales = new ArrayList<>();
        for (CandidateDecision candidate : ranked) {
            int conflict = findConflict(kept, candidate.actionId());
            if (conflict >= 0) {
                rationales.get(conflict)
                        .append(" [suppressed ").append(candidate.actionId())
                        .append(" (score ").append(RationaleRenderer.formatScore(candidate.score()))
                        .append("): mutually exclusive]");
                log.debug("Subject {}: {} suppressed by {}", subjectId, candidate.actionId(),
                        kept.get(conflict).actionId());
                continue;
            }
            kept.add(candidate);
            rationales.add(new StringBuilder(candidate.rationale()));
        }

        List<ScoredAction> actions = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            CandidateDecision c = kept.get(i);
            actions.add(new ScoredAction(c.actionId(), c.score(), rationales.get(i).toString()));
        }
        return new DecisionRecord(subjectId, actions);
    }

    private int findConflict(List<CandidateDecision> kept, String actionId) {
        for (int i = 0; i < kept.size(); i++) {
            if (config.excludes(kept.get(i).actionId(), actionId)) {
                return i;
            }
        }
        return -1;
    }

    private static CandidateDecision stronger(CandidateDecision current, CandidateDecision other) {
        if (other.score() > current.score()) {
            return other;
        }
        if (other.score() == current.score() && other.ruleId().compareTo(current.ruleId()) < 0) {
            return other;
        }
        return current;
    }

    public AggregationConfig getConfig() {
        return config;
    }
}
