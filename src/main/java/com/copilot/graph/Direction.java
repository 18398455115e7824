package com.copilot.graph;

import java.util.Locale;

/**
 * Edge direction relative to the queried node.
 */
public enum Direction {
    OUT,
    IN,
    BOTH;

    public static Direction parse(String label) {
        if (label == null || label.isBlank()) {
            return OUT;
        }
        return Direction.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
