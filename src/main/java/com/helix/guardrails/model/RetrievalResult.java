package com.helix.guardrails.model;

import java.util.Map;

public record RetrievalResult(String content, Map<String, Object> metadata, double similarity) {

    public static RetrievalResult from(VectorMatch match) {
        return new RetrievalResult(match.content(), match.metadata(), 1.0 - match.distance());
    }
}
