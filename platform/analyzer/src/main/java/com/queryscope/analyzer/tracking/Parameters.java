package com.queryscope.analyzer.tracking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameter snapshots: insertion-ordered, unmodifiable, null values allowed.
 */
final class Parameters {

    private static final Map<String, Object> EMPTY = Map.of();
    private static final Class<?> VIEW_TYPE = Collections.unmodifiableMap(new LinkedHashMap<>()).getClass();

    private Parameters() {}

    static Map<String, Object> snapshot(Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>(parameters.size() * 2);
        parameters.forEach((name, value) -> copy.put(name, value instanceof byte[] bytes ? bytes.clone() : value));
        return Collections.unmodifiableMap(copy);
    }

    /** Snapshot unless the map already is one made by {@link #snapshot}. */
    @SuppressWarnings("unchecked")
    static Map<String, Object> frozen(Map<String, ?> parameters) {
        if (parameters == EMPTY || (parameters != null && parameters.getClass() == VIEW_TYPE)) {
            return (Map<String, Object>) parameters;
        }
        return snapshot(parameters);
    }
}
