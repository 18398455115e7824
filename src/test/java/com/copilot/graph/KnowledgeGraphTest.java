package com.copilot.graph;

import com.copilot.exception.DanglingEdgeException;
import com.copilot.exception.DuplicateEdgeException;
import com.copilot.exception.DuplicateNodeException;
import com.copilot.exception.GraphFrozenException;
import com.copilot.exception.SelfLoopException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KnowledgeGraph.
 */
class KnowledgeGraphTest {

    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph();
        graph.addNode(Node.of("S1", NodeType.SUBJECT));
        graph.addNode(Node.of("C1", NodeType.COHORT));
        graph.addNode(Node.of("C2", NodeType.COHORT));
        graph.addNode(Node.of("T1", NodeType.TOPIC));
    }

    // =====================================================================
    // Construction
    // =====================================================================

    @Test
    @DisplayName("Duplicate node id is rejected")
    void duplicateNodeRejected() {
        DuplicateNodeException e = assertThrows(DuplicateNodeException.class,
                () -> graph.addNode(Node.of("S1", NodeType.TOPIC)));
        assertEquals("S1", e.getNodeId());
    }

    @Test
    @DisplayName("Edge to a missing node is rejected")
    void danglingEdgeRejected() {
        DanglingEdgeException e = assertThrows(DanglingEdgeException.class,
                () -> graph.addEdge(new Edge("S1", "NOPE", Relation.BELONGS_TO)));
        assertEquals("NOPE", e.getNodeId());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    @DisplayName("Self-loop is rejected")
    void selfLoopRejected() {
        assertThrows(SelfLoopException.class, () -> graph.addEdge(new Edge("S1", "S1", Relation.RELATED_TO)));
    }

    @Test
    @DisplayName("Same source, target and relation twice is rejected; another relation is allowed")
    void duplicateEdgeRejected() {
        graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO));
        assertThrows(DuplicateEdgeException.class, () -> graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO)));

        graph.addEdge(new Edge("S1", "C1", Relation.RELATED_TO));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    @DisplayName("Frozen graph rejects every mutation")
    void frozenGraphRejectsMutation() {
        graph.freeze();
        graph.freeze();

        assertTrue(graph.isFrozen());
        assertThrows(GraphFrozenException.class, () -> graph.addNode(Node.of("X", NodeType.TOPIC)));
        assertThrows(GraphFrozenException.class, () -> graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO)));
        assertEquals(4, graph.nodeCount());
    }

    @Test
    @DisplayName("Node attributes are an immutable copy")
    void nodeAttributesAreCopied() {
        HashMap<String, Object> attributes = new HashMap<>(Map.of("level", "Senior"));
        Node node = new Node("S2", NodeType.SUBJECT, attributes);
        attributes.put("level", "Junior");

        assertEquals("Senior", node.attribute("level").orElse(null));
        assertThrows(UnsupportedOperationException.class, () -> node.attributes().put("x", 1));
    }

    // =====================================================================
    // Neighbors
    // =====================================================================

    @Test
    @DisplayName("Neighbors follow edge insertion order and filter by relation")
    void neighborsInInsertionOrder() {
        graph.addEdge(new Edge("S1", "C2", Relation.BELONGS_TO));
        graph.addEdge(new Edge("S1", "T1", Relation.RELATED_TO));
        graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO));

        assertEquals(List.of("C2", "C1"), ids(graph.neighbors("S1", Relation.BELONGS_TO)));
        assertEquals(List.of("C2", "T1", "C1"), ids(graph.neighbors("S1", null, Direction.OUT)));
    }

    @Test
    @DisplayName("Incoming and both-direction neighbors")
    void neighborsByDirection() {
        graph.addEdge(new Edge("C1", "S1", Relation.RELATED_TO));
        graph.addEdge(new Edge("S1", "T1", Relation.RELATED_TO));

        assertEquals(List.of("C1"), ids(graph.neighbors("S1", Relation.RELATED_TO, Direction.IN)));
        assertEquals(List.of("C1", "T1"), ids(graph.neighbors("S1", Relation.RELATED_TO, Direction.BOTH)));
    }

    @Test
    @DisplayName("Unknown node has no neighbors")
    void unknownNodeHasNoNeighbors() {
        assertTrue(graph.neighbors("missing", null, Direction.BOTH).isEmpty());
    }

    // =====================================================================
    // Paths
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Path of length 2 respects the hop cutoff")
    @CsvSource({
            "0, false",
            "1, false",
            "2, true",
            "5, true"
    })
    void pathRespectsCutoff(int maxHops, boolean expected) {
        graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO));
        graph.addEdge(new Edge("C1", "T1", Relation.RELATED_TO));

        assertEquals(expected, graph.hasPath("S1", "T1", maxHops));
    }

    @Test
    @DisplayName("Path search follows outgoing edges only")
    void pathIsDirected() {
        graph.addEdge(new Edge("S1", "C1", Relation.BELONGS_TO));

        assertTrue(graph.hasPath("S1", "C1", 1));
        assertFalse(graph.hasPath("C1", "S1", 3));
    }

    @Test
    @DisplayName("Cycles terminate and shortest hop count is reported")
    void cyclesTerminate() {
        graph.addEdge(new Edge("S1", "C1", Relation.RELATED_TO));
        graph.addEdge(new Edge("C1", "C2", Relation.RELATED_TO));
        graph.addEdge(new Edge("C2", "S1", Relation.RELATED_TO));
        graph.addEdge(new Edge("C2", "T1", Relation.TRIGGERS));
        graph.addEdge(new Edge("S1", "C2", Relation.BELONGS_TO));

        assertEquals(2, graph.hopDistance("S1", "T1", 10).orElse(-1));
        assertFalse(graph.hasPath("T1", "S1", 100));
    }

    @Test
    @DisplayName("A node reaches itself in zero hops; unknown ids never do")
    void pathEdgeCases() {
        assertTrue(graph.hasPath("S1", "S1", 0));
        assertFalse(graph.hasPath("S1", "missing", 3));
        assertFalse(graph.hasPath("missing", "S1", 3));
    }

    @Test
    @DisplayName("GraphBuilder produces a frozen graph")
    void builderFreezes() {
        KnowledgeGraph built = GraphBuilder.create()
                .node("E1", NodeType.SUBJECT, Map.of("level", "Senior"))
                .node("D1", NodeType.COHORT)
                .edge("E1", "D1", Relation.WORKS_IN, 0.5)
                .build();

        assertTrue(built.isFrozen());
        assertEquals(0.5, built.outgoingEdges("E1").get(0).weight());
        assertEquals(List.of("E1"), ids(built.nodesOfType(NodeType.SUBJECT)));
    }

    @ParameterizedTest
    @DisplayName("Labels parse case-insensitively")
    @CsvSource({
            "ActionTemplate, ACTION_TEMPLATE",
            "action-template, ACTION_TEMPLATE",
            "Subject, SUBJECT",
            "cohort, COHORT"
    })
    void nodeTypeLabels(String label, NodeType expected) {
        assertEquals(expected, NodeType.parse(label));
    }

    @Test
    @DisplayName("Relation labels accept dashes and lower case")
    void relationLabels() {
        assertEquals(Relation.BELONGS_TO, Relation.parse("belongs-to"));
        assertEquals(Relation.HAS_SKILL, Relation.parse("has_skill"));
        assertEquals("works_in", Relation.WORKS_IN.label());
        assertThrows(IllegalArgumentException.class, () -> Relation.parse("likes"));
    }

    private static List<String> ids(List<Node> nodes) {
        return nodes.stream().map(Node::id).toList();
    }
}
