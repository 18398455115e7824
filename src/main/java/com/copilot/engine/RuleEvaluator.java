package com.copilot.engine;

import com.copilot.condition.Condition;
import com.copilot.condition.EvaluationContext;
import com.copilot.condition.MatchTrace;
import com.copilot.condition.impl.OrCondition;
import com.copilot.exception.MissingFeatureException;
import com.copilot.feature.FeatureVector;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.rule.Rule;
import com.copilot.rule.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Evaluates every rule of a rule set against one subject and emits a candidate decision
 * per rule whose condition holds.
 * <p>
 * The score of a fired rule is its base score times a confidence multiplier. For a rule
 * whose root condition is an OR, the multiplier is the fraction of root branches that hold
 * (all branches are evaluated to count them); otherwise it is 1.0.
 * <p>
 * A predicate on a feature the subject does not carry makes that rule false. For a root OR
 * only the affected branch counts as unmatched. Evaluation of other rules continues.
 * <p>
 * Stateless; safe to share between worker threads.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleSet ruleSet;
    private final KnowledgeGraph graph;
    private final RationaleRenderer renderer;

    public RuleEvaluator(RuleSet ruleSet, KnowledgeGraph graph) {
        this(ruleSet, graph, new RationaleRenderer());
    }

    public RuleEvaluator(RuleSet ruleSet, KnowledgeGraph graph, RationaleRenderer renderer) {
        this.ruleSet = ruleSet;
        this.graph = graph;
        this.renderer = renderer;
    }

    /**
     * Evaluate all rules for one subject.
     *
     * @param subjectId Subject id
     * @param features  Subject's feature vector
     * @return Candidates in rule evaluation order
     */
    public List<CandidateDecision> evaluate(String subjectId, FeatureVector features) {
        EvaluationContext context = new EvaluationContext(subjectId, features, graph);
        List<CandidateDecision> candidates = new ArrayList<>();

        for (Rule rule : ruleSet) {
            MatchTrace trace = new MatchTrace();
            OptionalDouble multiplier = match(rule, context, trace);
            if (multiplier.isEmpty()) {
                log.trace("Rule {} did not match subject {}", rule.id(), subjectId);
                continue;
            }
            double score = rule.consequence().baseScore() * multiplier.getAsDouble();
            String rationale = renderer.render(rule.explanationTemplate(), subjectId, rule.id(),
                    rule.actionId(), score, trace);
            candidates.add(new CandidateDecision(subjectId, rule.id(), rule.actionId(), score, rationale));
            log.debug("Rule {} fired for subject {}: {} with score {}", rule.id(), subjectId,
                    rule.actionId(), RationaleRenderer.formatScore(score));
        }
        return candidates;
    }

    /**
     * @return the confidence multiplier if the rule's condition holds, empty otherwise
     */
    private OptionalDouble match(Rule rule, EvaluationContext context, MatchTrace trace) {
        Condition condition = rule.condition();
        if (condition instanceof OrCondition or) {
            return matchBranches(rule, or.getConditions(), context, trace);
        }
        try {
            return condition.evaluate(context, trace) ? OptionalDouble.of(1.0) : OptionalDouble.empty();
        } catch (MissingFeatureException e) {
            log.debug("Rule {} skipped for subject {}: missing feature '{}'",
                    rule.id(), context.subjectId(), e.getFeature());
            return OptionalDouble.empty();
        }
    }

    private OptionalDouble matchBranches(Rule rule, List<Condition> branches,
                                         EvaluationContext context, MatchTrace trace) {
        int matched = 0;
        for (Condition branch : branches) {
            MatchTrace scratch = trace.child();
            try {
                if (branch.evaluate(context, scratch)) {
                    matched++;
                    trace.merge(scratch);
                }
            } catch (MissingFeatureException e) {
                log.debug("Branch of rule {} unmatched for subject {}: missing feature '{}'",
                        rule.id(), context.subjectId(), e.getFeature());
            }
        }
        if (matched == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) matched / branches.size());
    }
}
