package com.copilot.feature;

import java.util.Optional;
import java.util.Set;

/**
 * Supplies per-subject feature vectors to the decision engine.
 * Implementations are owned by the ingestion side; the engine only reads.
 */
public interface FeatureStore {

    /**
     * Get the feature vector for a subject.
     *
     * @param subjectId Subject identifier
     * @return Feature vector, or empty if the store knows nothing about the subject
     */
    Optional<FeatureVector> features(String subjectId);

    /**
     * All subject ids the store holds, in a stable order.
     */
    Set<String> subjectIds();
}
