package com.helix.guardrails.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionRequest {

    @Singular
    List<ChatMessage> messages;

    @Builder.Default
    double temperature = 0.0;

    @Builder.Default
    int maxOutputTokens = 4096;

    /**
     * Best-effort request for JSON-only decoding; translated per backend.
     */
    boolean constrainedJson;
}
