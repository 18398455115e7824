package com.copilot.config;

import java.util.Map;

/**
 * Node as declared in configuration.
 *
 * @param id         Node id
 * @param type       Node type label
 * @param attributes Attribute values
 */
public record NodeDefinition(String id, String type, Map<String, Object> attributes) {
}
