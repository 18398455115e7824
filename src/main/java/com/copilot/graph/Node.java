package com.copilot.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed node in the knowledge graph.
 *
 * @param id         Unique, opaque identifier
 * @param type       Node type, fixed at creation
 * @param attributes Attribute values by name (immutable copy, declaration order kept)
 */
public record Node(String id, NodeType type, Map<String, Object> attributes) {

    public Node {
        Objects.requireNonNull(id, "Node id cannot be null");
        Objects.requireNonNull(type, "Node type cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be blank");
        }
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Node of(String id, NodeType type) {
        return new Node(id, type, Map.of());
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public String toString() {
        return type + "(" + id + ")";
    }
}
