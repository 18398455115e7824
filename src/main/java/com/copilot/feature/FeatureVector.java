package com.copilot.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Feature values for one subject, by feature name.
 * Immutable after creation - values are snapshots handed in by the feature store.
 */
public final class FeatureVector {

    private static final FeatureVector EMPTY = new FeatureVector(Map.of());

    private final Map<String, Object> values;

    private FeatureVector(Map<String, Object> values) {
        this.values = values;
    }

    public static FeatureVector of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "Feature name cannot be null");
            if (entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new FeatureVector(Collections.unmodifiableMap(copy));
    }

    public static FeatureVector empty() {
        return EMPTY;
    }

    /**
     * Get a feature value. A null value in the source map counts as absent.
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * Return a vector with {@code name} derived from the existing values, unless it is
     * already present. The derivation may return null to skip.
     */
    public FeatureVector withDerived(String name, Function<FeatureVector, Object> derivation) {
        if (has(name)) {
            return this;
        }
        Object derived = derivation.apply(this);
        if (derived == null) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, derived);
        return new FeatureVector(Collections.unmodifiableMap(copy));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureVector" + values;
    }
}
