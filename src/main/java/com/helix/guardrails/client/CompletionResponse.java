package com.helix.guardrails.client;

import java.util.Map;

/**
 * Normalized completion result from any backend.
 *
 * @param content raw generated text, never null
 * @param modelId model identifier the request was routed to
 * @param usage   backend-reported token counts, possibly empty
 */
public record CompletionResponse(String content, String modelId, Map<String, Object> usage) {

    public CompletionResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : usage;
    }
}
