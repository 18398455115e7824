package com.copilot.feature;

/**
 * Derives the categorical {@code engagement} feature from a numeric survey {@code score}.
 * Scores of 2 or less are low, exactly 3 is medium, any other score is high.
 */
public final class EngagementFeatures {

    public static final String SCORE = "score";
    public static final String ENGAGEMENT = "engagement";

    public static final String LOW = "low";
    public static final String MEDIUM = "medium";
    public static final String HIGH = "high";

    private EngagementFeatures() {
    }

    public static String engagementLevel(double score) {
        if (score <= 2) {
            return LOW;
        }
        if (score == 3) {
            return MEDIUM;
        }
        return HIGH;
    }

    /**
     * Add {@code engagement} to a vector carrying a numeric {@code score}.
     * Vectors that already have an engagement level, or no usable score, are returned unchanged.
     */
    public static FeatureVector derive(FeatureVector vector) {
        return vector.withDerived(ENGAGEMENT, v -> v.get(SCORE)
                .map(EngagementFeatures::toDouble)
                .map(score -> Double.isNaN(score) ? null : engagementLevel(score))
                .orElse(null));
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
