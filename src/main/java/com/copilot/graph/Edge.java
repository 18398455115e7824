package com.copilot.graph;

import java.util.Objects;

/**
 * A directed, typed, weighted edge.
 *
 * @param sourceId Source node id
 * @param targetId Target node id
 * @param relation Edge label
 * @param weight   Edge weight (1.0 unless given)
 */
public record Edge(String sourceId, String targetId, Relation relation, double weight) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Edge {
        Objects.requireNonNull(sourceId, "Edge source cannot be null");
        Objects.requireNonNull(targetId, "Edge target cannot be null");
        Objects.requireNonNull(relation, "Edge relation cannot be null");
    }

    public Edge(String sourceId, String targetId, Relation relation) {
        this(sourceId, targetId, relation, DEFAULT_WEIGHT);
    }

    @Override
    public String toString() {
        return sourceId + " -[" + relation + "]-> " + targetId;
    }
}
