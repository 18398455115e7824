package com.copilot.condition;

import com.copilot.feature.FeatureVector;
import com.copilot.graph.KnowledgeGraph;

import java.util.Objects;

/**
 * Everything a condition may read while evaluating one subject.
 *
 * @param subjectId Subject being evaluated
 * @param features  Subject's feature vector (read-only)
 * @param graph     Frozen knowledge graph (read-only)
 */
public record EvaluationContext(String subjectId, FeatureVector features, KnowledgeGraph graph) {

    public EvaluationContext {
        Objects.requireNonNull(subjectId, "Subject id cannot be null");
        Objects.requireNonNull(features, "Feature vector cannot be null");
        Objects.requireNonNull(graph, "Knowledge graph cannot be null");
    }
}
