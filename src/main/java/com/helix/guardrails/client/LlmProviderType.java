package com.helix.guardrails.client;

/**
 * Backends the completion client can talk to. A provider is configuration:
 * a default endpoint plus the wire dialect it speaks.
 */
public enum LlmProviderType {
    OPENAI("https://api.openai.com", WireDialect.OPENAI_COMPATIBLE),
    /** mlx_lm.server on Apple Silicon; OpenAI-compatible API, no embedding endpoint. */
    MLX("http://localhost:8080", WireDialect.OPENAI_COMPATIBLE),
    OLLAMA("http://localhost:11434", WireDialect.OLLAMA),
    GEMINI("https://generativelanguage.googleapis.com", WireDialect.GEMINI);

    private final String defaultBaseUrl;
    private final WireDialect dialect;

    LlmProviderType(String defaultBaseUrl, WireDialect dialect) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.dialect = dialect;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public WireDialect getDialect() {
        return dialect;
    }

    /**
     * Request/response shape, including how the constrained-JSON hint is expressed:
     * OpenAI-compatible servers take {@code response_format}, Ollama takes
     * {@code format: "json"}, Gemini takes a {@code responseMimeType}.
     */
    public enum WireDialect {
        OPENAI_COMPATIBLE,
        OLLAMA,
        GEMINI
    }
}
