package com.copilot.config;

import java.util.Objects;

/**
 * Two action ids that may not appear together in one decision record.
 * Unordered: {@code (a, b)} equals {@code (b, a)}.
 */
public record ExclusionPair(String first, String second) {

    public ExclusionPair {
        Objects.requireNonNull(first, "Exclusion action id cannot be null");
        Objects.requireNonNull(second, "Exclusion action id cannot be null");
        if (first.equals(second)) {
            throw new IllegalArgumentException("Action '" + first + "' cannot exclude itself");
        }
        if (first.compareTo(second) > 0) {
            String tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static ExclusionPair of(String a, String b) {
        return new ExclusionPair(a, b);
    }

    public boolean covers(String a, String b) {
        return (first.equals(a) && second.equals(b)) || (first.equals(b) && second.equals(a));
    }

    @Override
    public String toString() {
        return first + " x " + second;
    }
}
