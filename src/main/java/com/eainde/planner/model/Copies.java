package com.eainde.planner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order-preserving, unmodifiable, serializable copies for record components.
 */
final class Copies {

    private Copies() {}

    static <K, V> Map<K, V> ordered(Map<K, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
