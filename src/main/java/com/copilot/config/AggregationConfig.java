package com.copilot.config;

import java.util.Set;

/**
 * Settings of the decision aggregator.
 *
 * @param topK              Maximum actions per record ({@link #UNBOUNDED} for no limit)
 * @param minScore          Actions scoring below this are dropped
 * @param mutualExclusions  Action pairs that cannot co-occur in one record
 */
public record AggregationConfig(int topK, double minScore, Set<ExclusionPair> mutualExclusions) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public AggregationConfig {
        if (topK < 0) {
            throw new IllegalArgumentException("top-k cannot be negative: " + topK);
        }
        if (Double.isNaN(minScore)) {
            throw new IllegalArgumentException("min-score cannot be NaN");
        }
        mutualExclusions = mutualExclusions == null ? Set.of() : Set.copyOf(mutualExclusions);
    }

    /**
     * Unbounded, zero threshold, no exclusions.
     */
    public static AggregationConfig defaults() {
        return new AggregationConfig(UNBOUNDED, 0.0, Set.of());
    }

    public boolean excludes(String actionA, String actionB) {
        for (ExclusionPair pair : mutualExclusions) {
            if (pair.covers(actionA, actionB)) {
                return true;
            }
        }
        return false;
    }

    public boolean isBounded() {
        return topK != UNBOUNDED;
    }
}
