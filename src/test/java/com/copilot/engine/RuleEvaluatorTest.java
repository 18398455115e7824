package com.copilot.engine;

import com.copilot.feature.FeatureVector;
import com.copilot.graph.GraphBuilder;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.graph.NodeType;
import com.copilot.graph.Relation;
import com.copilot.rule.RuleDefinition;
import com.copilot.rule.RuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleEvaluator.
 */
class RuleEvaluatorTest {

    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = GraphBuilder.create()
                .node("E1", NodeType.SUBJECT, Map.of("level", "Senior"))
                .node("D1", NodeType.COHORT)
                .node("T1", NodeType.TOPIC)
                .node("meet", NodeType.ACTION_TEMPLATE)
                .node("train", NodeType.ACTION_TEMPLATE)
                .edge("E1", "D1", Relation.BELONGS_TO)
                .edge("D1", "T1", Relation.RELATED_TO)
                .build();
    }

    @Test
    @DisplayName("Fired rules produce candidates in rule order")
    void firedRulesInOrder() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("low", 1, "train", 0.5, "", "tenure >= 1"),
                RuleDefinition.expr("high", 9, "meet", 0.9, "", "engagement = 'low'"),
                RuleDefinition.expr("never", 5, "meet", 0.9, "", "engagement = 'high'"));

        List<CandidateDecision> candidates = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("engagement", "low", "tenure", 2)));

        assertEquals(List.of("high", "low"), candidates.stream().map(CandidateDecision::ruleId).toList());
        assertEquals(0.9, candidates.get(0).score());
        assertEquals("E1", candidates.get(0).subjectId());
    }

    @Test
    @DisplayName("Missing feature makes only that rule false")
    void missingFeatureDoesNotAbort() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("needs-tenure", 9, "train", 0.8, "", "tenure > 3"),
                RuleDefinition.expr("graph-only", 1, "meet", 0.6, "", "path_exists('T1', 2)"));

        List<CandidateDecision> candidates = evaluator.evaluate("E1", FeatureVector.empty());

        assertEquals(1, candidates.size());
        assertEquals("graph-only", candidates.get(0).ruleId());
    }

    @Test
    @DisplayName("Root OR scales the score by the fraction of matched branches")
    void rootOrMultiplier() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("any", 1, "meet", 0.8, "{score}",
                        "engagement = 'low' OR tenure < 1 OR connected(belongs_to, Cohort) OR level = 'x'"));

        List<CandidateDecision> half = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("engagement", "low", "tenure", 4, "level", "y")));
        assertEquals(0.4, half.get(0).score(), 1e-9);
        assertEquals("0.40", half.get(0).rationale());

        List<CandidateDecision> all = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("engagement", "low", "tenure", 0, "level", "x")));
        assertEquals(0.8, all.get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Missing feature in one root OR branch counts as unmatched")
    void rootOrBranchMissingFeature() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("any", 1, "meet", 1.0, "", "engagement = 'low' OR connected(belongs_to, Cohort)"));

        List<CandidateDecision> candidates = evaluator.evaluate("E1", FeatureVector.empty());

        assertEquals(1, candidates.size());
        assertEquals(0.5, candidates.get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Missing feature in a nested OR branch counts as unmatched")
    void nestedOrBranchMissingFeature() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("root", 2, "meet", 1.0, "", "age > 30 OR engagement = 'low'"),
                RuleDefinition.expr("nested", 1, "train", 0.6, "{engagement}",
                        "(age > 30 OR engagement = 'low') AND TRUE"),
                RuleDefinition.expr("negated", 0, "train", 0.9, "", "NOT (age > 30 OR tenure > 1)"));

        List<CandidateDecision> candidates = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("engagement", "low")));

        assertEquals(List.of("root", "nested"), candidates.stream().map(CandidateDecision::ruleId).toList());
        assertEquals(0.5, candidates.get(0).score(), 1e-9);
        assertEquals(0.6, candidates.get(1).score(), 1e-9);
        assertEquals("low", candidates.get(1).rationale());
    }

    @Test
    @DisplayName("Nested OR does not scale the score")
    void nestedOrNoMultiplier() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("nested", 1, "meet", 0.7, "", "tenure > 0 AND (a = 1 OR b = 2)"));

        List<CandidateDecision> candidates = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("tenure", 1, "a", 1, "b", 0)));

        assertEquals(0.7, candidates.get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Rationale is filled from matched values")
    void rationaleFromTrace() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("r1", 1, "train", 0.75, "{subject} {subject.level} eng={engagement} "
                                + "hops={path.T1} cohorts={connected.belongs_to} {action}/{rule} {score} {unknown}",
                        "engagement = 'low' AND attribute(subject, level) = 'Senior' "
                                + "AND path_exists('T1', 3) AND connected(belongs_to, Cohort)"));

        CandidateDecision candidate = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("engagement", "low"))).get(0);

        assertEquals("E1 Senior eng=low hops=2 cohorts=D1 train/r1 0.75 {unknown}", candidate.rationale());
    }

    @Test
    @DisplayName("Values from negated or failed branches are not bound")
    void negatedBranchesBindNothing() {
        RuleEvaluator evaluator = evaluator(
                RuleDefinition.expr("r1", 1, "meet", 1.0, "[{tenure}] [{engagement}]",
                        "NOT tenure > 5 AND (engagement = 'high' OR engagement != 'x')"));

        CandidateDecision candidate = evaluator.evaluate("E1",
                FeatureVector.of(Map.of("tenure", 2, "engagement", "low"))).get(0);

        assertEquals("[{tenure}] [low]", candidate.rationale());
    }

    private RuleEvaluator evaluator(RuleDefinition... definitions) {
        return new RuleEvaluator(RuleSet.fromDefinitions(List.of(definitions), graph), graph);
    }
}
