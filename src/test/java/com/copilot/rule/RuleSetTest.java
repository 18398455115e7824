package com.copilot.rule;

import com.copilot.condition.ConditionConfig;
import com.copilot.exception.RuleValidationException;
import com.copilot.graph.GraphBuilder;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.graph.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleSet loading, ordering and validation.
 */
class RuleSetTest {

    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = GraphBuilder.create()
                .node("S1", NodeType.SUBJECT)
                .node("T1", NodeType.TOPIC)
                .node("A1", NodeType.ACTION_TEMPLATE)
                .node("A2", NodeType.ACTION_TEMPLATE)
                .build();
    }

    @Test
    @DisplayName("Rules iterate by priority desc, then declaration order")
    void evaluationOrder() {
        RuleSet rules = RuleSet.fromDefinitions(List.of(
                rule("low", 1),
                rule("high-a", 10),
                rule("mid", 5),
                rule("high-b", 10)
        ), graph);

        assertEquals(List.of("high-a", "high-b", "mid", "low"), ids(rules));
    }

    @Test
    @DisplayName("Iteration is restartable and identical across loads")
    void deterministicIteration() {
        List<RuleDefinition> definitions = List.of(rule("r1", 3), rule("r2", 3), rule("r3", 7));

        RuleSet first = RuleSet.fromDefinitions(definitions, graph);
        RuleSet second = RuleSet.fromDefinitions(definitions, graph);

        assertEquals(ids(first), ids(first));
        assertEquals(ids(first), ids(second));
        assertEquals(List.of("r3", "r1", "r2"), ids(first));
    }

    @Test
    @DisplayName("Order depends on declaration index, not list position passed to load")
    void loadSortsShuffledRules() {
        List<Rule> compiled = new ArrayList<>(new RuleFactory().create(List.of(
                rule("a", 1), rule("b", 1), rule("c", 1))));
        Collections.reverse(compiled);

        assertEquals(List.of("a", "b", "c"), ids(RuleSet.load(compiled)));
    }

    @Test
    @DisplayName("Duplicate rule id is rejected")
    void duplicateId() {
        RuleValidationException e = assertThrows(RuleValidationException.class,
                () -> RuleSet.fromDefinitions(List.of(rule("dup", 1), rule("dup", 2)), graph));
        assertEquals("dup", e.getRuleId());
    }

    @Test
    @DisplayName("Consequence must name an action template node")
    void actionMustExist() {
        assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.of("r", 1, "NOPE", 0.5, "", ConditionConfig.alwaysTrue())), graph));
        assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.of("r", 1, "T1", 0.5, "", ConditionConfig.alwaysTrue())), graph));
    }

    @Test
    @DisplayName("Path target must exist, also inside NOT")
    void pathTargetMustExist() {
        RuleValidationException e = assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.expr("r", 1, "A1", 0.5, "", "x = 1 AND NOT path_exists('MISSING', 2)")), graph));
        assertEquals("r", e.getRuleId());
        assertTrue(e.getMessage().contains("MISSING"));
    }

    @Test
    @DisplayName("Malformed conditions report the rule id")
    void malformedCondition() {
        RuleValidationException e = assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.expr("bad-expr", 1, "A1", 0.5, "", "tenure > 'three'")), graph));
        assertEquals("bad-expr", e.getRuleId());

        RuleValidationException tree = assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.of("bad-tree", 1, "A1", 0.5, "", ConditionConfig.connected("likes", "Topic"))), graph));
        assertEquals("bad-tree", tree.getRuleId());

        RuleValidationException hops = assertThrows(RuleValidationException.class, () -> RuleSet.fromDefinitions(List.of(
                RuleDefinition.expr("far", 1, "A1", 0.5, "", "path_exists('T', 99999999999)")), graph));
        assertEquals("far", hops.getRuleId());
        assertTrue(hops.getMessage().contains("hop limit out of range"));
    }

    @Test
    @DisplayName("Rule definitions are validated")
    void definitionValidation() {
        RuleFactory factory = new RuleFactory();

        assertThrows(RuleValidationException.class,
                () -> factory.create(RuleDefinition.of(null, 1, "A1", 0.5, "", null), 0));
        assertThrows(RuleValidationException.class,
                () -> factory.create(RuleDefinition.of("r", 1, null, 0.5, "", null), 0));
        assertThrows(RuleValidationException.class,
                () -> factory.create(RuleDefinition.of("r", 1, "A1", -0.1, "", null), 0));
        assertThrows(RuleValidationException.class,
                () -> factory.create(RuleDefinition.of("r", 1, "A1", Double.NaN, "", null), 0));
        assertThrows(RuleValidationException.class, () -> factory.create(
                new RuleDefinition("r", 1, "A1", 0.5, "", ConditionConfig.alwaysTrue(), "x = 1"), 0));
    }

    @Test
    @DisplayName("Lookup by id")
    void lookup() {
        RuleSet rules = RuleSet.fromDefinitions(List.of(rule("r1", 1)), graph);

        assertTrue(rules.get("r1").isPresent());
        assertTrue(rules.get("r2").isEmpty());
        assertEquals("A1", rules.get("r1").orElseThrow().actionId());
        assertFalse(rules.isEmpty());
    }

    private static RuleDefinition rule(String id, int priority) {
        return RuleDefinition.expr(id, priority, "A1", 0.5, "", "x = 1");
    }

    private static List<String> ids(RuleSet rules) {
        List<String> ids = new ArrayList<>();
        for (Rule rule : rules) {
            ids.add(rule.id());
        }
        return ids;
    }
}
