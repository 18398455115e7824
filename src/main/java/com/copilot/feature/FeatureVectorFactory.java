package com.copilot.feature;

import com.copilot.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates feature vectors from JSON.
 * Nested JSON objects are flattened using dot notation (e.g., {"survey":{"q1":4}} becomes "survey.q1" -> 4).
 */
public final class FeatureVectorFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private FeatureVectorFactory() {
    }

    /**
     * Create a single vector from a JSON object of features.
     */
    public static FeatureVector vectorFromJson(String json) {
        if (json == null || json.isBlank()) {
            return FeatureVector.empty();
        }
        return FeatureVector.of(flatten(parseJson(json)));
    }

    /**
     * Create a feature store from a JSON object keyed by subject id:
     * <pre>
     * {"E1": {"score": 2, "level": "Senior"}, "E2": {...}}
     * </pre>
     * Subjects keep document order. Each vector gets {@code engagement} derived from
     * {@code score} when it does not carry one.
     */
    @SuppressWarnings("unchecked")
    public static InMemoryFeatureStore storeFromJson(String json) {
        InMemoryFeatureStore.Builder builder = InMemoryFeatureStore.builder();
        if (json == null || json.isBlank()) {
            return builder.build();
        }
        for (Map.Entry<String, Object> entry : parseJson(json).entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                throw new IllegalArgumentException("Features for subject '" + entry.getKey()
                        + "' must be a JSON object");
            }
            FeatureVector vector = FeatureVector.of(flatten((Map<String, Object>) entry.getValue()));
            builder.subject(entry.getKey(), EngagementFeatures.derive(vector));
        }
        return builder.build();
    }

    /**
     * Load a feature store from a path. Supports classpath: prefix for classpath resources.
     *
     * @throws ConfigurationException if the file cannot be read or does not hold valid feature JSON
     */
    public static InMemoryFeatureStore load(String path) {
        Resource resource = path.startsWith("classpath:")
                ? new ClassPathResource(path.substring("classpath:".length()))
                : new FileSystemResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return storeFromJson(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load features from: " + path, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid features in " + path + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid feature JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Flatten nested maps into dot-notation keys, keeping key order.
     */
    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value instanceof List) {
                // Lists stay as-is; predicates compare them by string form
                result.put(key, value);
            } else {
                result.put(key, value);
            }
        }
    }
}
