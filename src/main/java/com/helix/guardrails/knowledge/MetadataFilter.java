package com.helix.guardrails.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunction of metadata equality conditions applied to a vector query.
 */
public final class MetadataFilter {

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    private final Map<String, Object> conditions;

    private MetadataFilter(Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter eq(String key, Object value) {
        return NONE.and(key, value);
    }

    /**
     * Builds a filter from a map; null values are skipped.
     */
    public static MetadataFilter of(Map<String, ?> equalities) {
        MetadataFilter filter = NONE;
        if (equalities != null) {
            for (Map.Entry<String, ?> e : equalities.entrySet()) {
                if (e.getValue() != null) {
                    filter = filter.and(e.getKey(), e.getValue());
                }
            }
        }
        return filter;
    }

    public MetadataFilter and(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(conditions);
        next.put(key, value);
        return new MetadataFilter(Collections.unmodifiableMap(next));
    }

    public Map<String, Object> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public String toString() {
        return conditions.toString();
    }
}
