package com.copilot.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Feature store backed by an insertion-ordered map of materialized vectors.
 */
public class InMemoryFeatureStore implements FeatureStore {

    private final Map<String, FeatureVector> vectors;

    public InMemoryFeatureStore(Map<String, FeatureVector> vectors) {
        this.vectors = Collections.unmodifiableMap(new LinkedHashMap<>(vectors));
    }

    @Override
    public Optional<FeatureVector> features(String subjectId) {
        return Optional.ofNullable(vectors.get(subjectId));
    }

    @Override
    public Set<String> subjectIds() {
        return vectors.keySet();
    }

    public int size() {
        return vectors.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for InMemoryFeatureStore.
     */
    public static final class Builder {
        private final Map<String, FeatureVector> vectors = new LinkedHashMap<>();

        public Builder subject(String subjectId, Map<String, ?> features) {
            vectors.put(subjectId, FeatureVector.of(features));
            return this;
        }

        public Builder subject(String subjectId, FeatureVector vector) {
            vectors.put(subjectId, vector);
            return this;
        }

        public InMemoryFeatureStore build() {
            return new InMemoryFeatureStore(vectors);
        }
    }
}
