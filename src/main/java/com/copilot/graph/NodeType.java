package com.copilot.graph;

import java.util.Locale;

/**
 * Fixed set of node types in the knowledge graph.
 */
public enum NodeType {
    SUBJECT,
    COHORT,
    TOPIC,
    ACTION_TEMPLATE;

    /**
     * Parse a node type label. Accepts "ActionTemplate", "action-template" and "ACTION_TEMPLATE".
     *
     * @throws IllegalArgumentException if the label names no node type
     */
    public static NodeType parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Node type cannot be blank");
        }
        String normalized = label.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        return NodeType.valueOf(normalized);
    }
}
