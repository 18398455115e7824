package com.copilot.condition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values bound by predicates that held during one rule evaluation.
 * Keys are the placeholder names used by explanation templates.
 * <p>
 * Not thread-safe; one trace per rule evaluation.
 */
public final class MatchTrace {

    private final Map<String, String> bindings = new LinkedHashMap<>();

    public void bind(String name, Object value) {
        bindings.putIfAbsent(name, ValueMatcher.format(value));
    }

    /**
     * A scratch trace whose bindings only count once merged back.
     */
    public MatchTrace child() {
        return new MatchTrace();
    }

    public void merge(MatchTrace other) {
        for (Map.Entry<String, String> entry : other.bindings.entrySet()) {
            bindings.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    public Map<String, String> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return "MatchTrace" + bindings;
    }
}
