package com.helix.guardrails.model;

import java.util.Map;

/**
 * Raw vector-store hit. Distance is {@code 1 - cosine score}; smaller is closer.
 */
public record VectorMatch(String id, String content, Map<String, Object> metadata, double distance) {

    public VectorMatch {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
