package com.copilot.graph;

import java.util.Map;

/**
 * Fluent builder producing a frozen {@link KnowledgeGraph}.
 * Nodes must be declared before the edges that reference them.
 *
 * <pre>
 * KnowledgeGraph graph = GraphBuilder.create()
 *         .node("E1", NodeType.SUBJECT, Map.of("level", "Senior"))
 *         .node("D1", NodeType.COHORT)
 *         .edge("E1", "D1", Relation.WORKS_IN)
 *         .build();
 * </pre>
 */
public final class GraphBuilder {

    private final KnowledgeGraph graph = new KnowledgeGraph();

    private GraphBuilder() {
    }

    public static GraphBuilder create() {
        return new GraphBuilder();
    }

    public GraphBuilder node(String id, NodeType type) {
        graph.addNode(Node.of(id, type));
        return this;
    }

    public GraphBuilder node(String id, NodeType type, Map<String, Object> attributes) {
        graph.addNode(new Node(id, type, attributes));
        return this;
    }

    public GraphBuilder edge(String sourceId, String targetId, Relation relation) {
        graph.addEdge(new Edge(sourceId, targetId, relation));
        return this;
    }

    public GraphBuilder edge(String sourceId, String targetId, Relation relation, double weight) {
        graph.addEdge(new Edge(sourceId, targetId, relation, weight));
        return this;
    }

    /**
     * Freeze and return the graph. The builder must not be used afterwards.
     */
    public KnowledgeGraph build() {
        graph.freeze();
        return graph;
    }

    /**
     * Return the graph without freezing it.
     */
    public KnowledgeGraph buildMutable() {
        return graph;
    }
}
