package com.copilot.feature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeatureVector and engagement derivation.
 */
class FeatureVectorTest {

    @Test
    @DisplayName("Null values count as absent")
    void nullValuesAreAbsent() {
        Map<String, Object> values = new HashMap<>();
        values.put("score", 3);
        values.put("team", null);

        FeatureVector vector = FeatureVector.of(values);

        assertTrue(vector.has("score"));
        assertFalse(vector.has("team"));
        assertTrue(vector.get("team").isEmpty());
        assertEquals(1, vector.size());
    }

    @Test
    @DisplayName("Vector is a snapshot of its source map")
    void vectorIsSnapshot() {
        Map<String, Object> values = new HashMap<>(Map.of("score", 3));
        FeatureVector vector = FeatureVector.of(values);
        values.put("score", 5);

        assertEquals(3, vector.get("score").orElse(null));
        assertThrows(UnsupportedOperationException.class, () -> vector.asMap().put("x", 1));
    }

    @ParameterizedTest
    @DisplayName("Survey score maps to engagement level")
    @CsvSource({
            "1, low",
            "2, low",
            "2.5, high",
            "3, medium",
            "3.1, high",
            "3.5, high",
            "5, high"
    })
    void engagementLevel(double score, String expected) {
        assertEquals(expected, EngagementFeatures.engagementLevel(score));
    }

    @Test
    @DisplayName("Engagement is derived from score unless already present")
    void deriveEngagement() {
        FeatureVector derived = EngagementFeatures.derive(FeatureVector.of(Map.of("score", 2)));
        assertEquals("low", derived.get(EngagementFeatures.ENGAGEMENT).orElse(null));

        FeatureVector explicit = FeatureVector.of(Map.of("score", 2, "engagement", "high"));
        assertSame(explicit, EngagementFeatures.derive(explicit));

        FeatureVector noScore = FeatureVector.of(Map.of("tenure", 4));
        assertFalse(EngagementFeatures.derive(noScore).has(EngagementFeatures.ENGAGEMENT));

        FeatureVector textScore = FeatureVector.of(Map.of("score", "n/a"));
        assertFalse(EngagementFeatures.derive(textScore).has(EngagementFeatures.ENGAGEMENT));
    }

    @Test
    @DisplayName("Vectors with the same values are equal")
    void equality() {
        assertEquals(FeatureVector.of(Map.of("a", 1)), FeatureVector.of(Map.of("a", 1)));
        assertEquals(FeatureVector.empty(), FeatureVector.of(Map.of()));
    }
}
