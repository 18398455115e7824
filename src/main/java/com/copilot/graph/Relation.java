package com.copilot.graph;

import java.util.Locale;

/**
 * Enumerated edge labels.
 */
public enum Relation {
    BELONGS_TO,
    RELATED_TO,
    TRIGGERS,

    // Organisation ontology
    WORKS_IN,
    HAS_ROLE,
    HAS_SKILL,
    REPORTS_TO;

    /**
     * Parse a relation label. Accepts "belongs_to", "belongs-to" and "BELONGS_TO".
     *
     * @throws IllegalArgumentException if the label names no relation
     */
    public static Relation parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Relation cannot be blank");
        }
        return Relation.valueOf(label.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    /**
     * Lower-case label used in rationale placeholders.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
