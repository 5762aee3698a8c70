package com.helix.guardrails.client;

/**
 * Chat completion against the configured model backend.
 *
 * Implementations translate {@link CompletionRequest} into the backend's wire format
 * and normalize the answer. Transport failures surface as
 * {@link com.helix.guardrails.exception.TransientIoException}.
 */
public interface LLMProvider {

    CompletionResponse complete(CompletionRequest request);

    /**
     * Provider and model in a form fit for log lines, e.g. {@code OLLAMA (qwen2.5:7b)}.
     */
    String describeBackend();
}
