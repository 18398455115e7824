package com.copilot.config;

/**
 * Edge as declared in configuration.
 *
 * @param source   Source node id
 * @param target   Target node id
 * @param relation Relation label
 * @param weight   Weight
 */
public record EdgeDefinition(String source, String target, String relation, double weight) {
}
