package com.copilot.config;

import com.copilot.exception.ConfigurationException;
import com.copilot.graph.Edge;
import com.copilot.graph.KnowledgeGraph;
import com.copilot.graph.Node;
import com.copilot.graph.NodeType;
import com.copilot.graph.Relation;
import com.copilot.rule.RuleDefinition;
import com.copilot.rule.RuleSet;

import java.util.List;

/**
 * Root configuration of the decision copilot.
 *
 * @param name        Configuration name
 * @param version     Configuration version
 * @param aggregation Decision aggregator settings
 * @param execution   Worker pool settings
 * @param nodes       Knowledge graph nodes
 * @param edges       Knowledge graph edges
 * @param rules       Rule definitions in declaration order
 */
public record CopilotConfig(
        String name,
        String version,
        AggregationConfig aggregation,
        ExecutionConfig execution,
        List<NodeDefinition> nodes,
        List<EdgeDefinition> edges,
        List<RuleDefinition> rules
) {
    public CopilotConfig {
        aggregation = aggregation == null ? AggregationConfig.defaults() : aggregation;
        execution = execution == null ? ExecutionConfig.defaults() : execution;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Build the frozen knowledge graph declared by this configuration.
     *
     * @throws ConfigurationException            on unknown node types or relations
     * @throws com.copilot.exception.GraphException on structural graph errors
     */
    public KnowledgeGraph buildGraph() {
        KnowledgeGraph graph = new KnowledgeGraph();
        for (NodeDefinition node : nodes) {
            graph.addNode(new Node(node.id(), parseType(node), node.attributes()));
        }
        for (EdgeDefinition edge : edges) {
            graph.addEdge(new Edge(edge.source(), edge.target(), parseRelation(edge), edge.weight()));
        }
        graph.freeze();
        return graph;
    }

    /**
     * Compile and validate the rules against a graph.
     */
    public RuleSet buildRuleSet(KnowledgeGraph graph) {
        return RuleSet.fromDefinitions(rules, graph);
    }

    private static NodeType parseType(NodeDefinition node) {
        try {
            return NodeType.parse(node.type());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Node '" + node.id() + "': " + e.getMessage(), e);
        }
    }

    private static Relation parseRelation(EdgeDefinition edge) {
        try {
            return Relation.parse(edge.relation());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Edge " + edge.source() + " -> " + edge.target()
                    + ": " + e.getMessage(), e);
        }
    }
}
