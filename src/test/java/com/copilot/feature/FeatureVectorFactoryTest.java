package com.copilot.feature;

import com.copilot.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeatureVectorFactory.
 */
class FeatureVectorFactoryTest {

    @Test
    @DisplayName("Nested objects flatten to dot notation")
    void nestedObjectsFlatten() {
        FeatureVector vector = FeatureVectorFactory.vectorFromJson("""
            {
                "score": 4,
                "skills": {"advanced": 2, "detail": {"python": "expert"}}
            }
            """);

        assertEquals(4, vector.get("score").orElse(null));
        assertEquals(2, vector.get("skills.advanced").orElse(null));
        assertEquals("expert", vector.get("skills.detail.python").orElse(null));
        assertFalse(vector.has("skills"));
    }

    @Test
    @DisplayName("Store keeps subject order and derives engagement")
    void storeFromJson() {
        InMemoryFeatureStore store = FeatureVectorFactory.storeFromJson("""
            {
                "E2": {"score": 1},
                "E1": {"score": 5, "engagement": "medium"},
                "E3": {}
            }
            """);

        assertEquals(List.of("E2", "E1", "E3"), List.copyOf(store.subjectIds()));
        assertEquals("low", store.features("E2").orElseThrow().get("engagement").orElse(null));
        assertEquals("medium", store.features("E1").orElseThrow().get("engagement").orElse(null));
        assertEquals(0, store.features("E3").orElseThrow().size());
        assertTrue(store.features("E9").isEmpty());
    }

    @Test
    @DisplayName("Subject features must be an object")
    void subjectMustBeObject() {
        assertThrows(IllegalArgumentException.class, () -> FeatureVectorFactory.storeFromJson("{\"E1\": 3}"));
        assertThrows(IllegalArgumentException.class, () -> FeatureVectorFactory.storeFromJson("{not json"));
    }

    @Test
    @DisplayName("Blank input yields empty results")
    void blankInput() {
        assertEquals(FeatureVector.empty(), FeatureVectorFactory.vectorFromJson(" "));
        assertEquals(0, FeatureVectorFactory.storeFromJson(null).size());
    }

    @Test
    @DisplayName("Load the sample features from the classpath")
    void loadFromClasspath() {
        InMemoryFeatureStore store = FeatureVectorFactory.load("classpath:sample-features.json");

        assertEquals(4, store.size());
        assertEquals(2, store.features("E001").orElseThrow().get("skills.advanced").orElse(null));
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> FeatureVectorFactory.load("/no/such/features.json"));
    }

    @Test
    @DisplayName("Invalid feature files are configuration errors naming the path")
    void invalidFile() {
        ConfigurationException malformed = assertThrows(ConfigurationException.class,
                () -> FeatureVectorFactory.load("classpath:malformed-features.json"));
        assertTrue(malformed.getMessage().contains("malformed-features.json"));
        assertInstanceOf(IllegalArgumentException.class, malformed.getCause());

        ConfigurationException scalar = assertThrows(ConfigurationException.class,
                () -> FeatureVectorFactory.load("classpath:scalar-subject-features.json"));
        assertTrue(scalar.getMessage().contains("E2"));
    }
}
