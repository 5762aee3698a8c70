package com.helix.guardrails.configuration;

import com.helix.guardrails.client.LlmProviderType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Model endpoint settings. The provider tag selects the wire dialect; everything
 * else about a backend is configuration.
 */
@Data
public class LlmProperties {

    @NotNull
    private LlmProviderType provider = LlmProviderType.OPENAI;

    @NotBlank
    private String model = "gpt-4o";

    /**
     * Overrides the provider's default endpoint when set.
     */
    private String baseUrl;

    private String apiKey;

    /**
     * Model loaded by a local mlx_lm.server; only consulted for the MLX provider.
     */
    private String mlxModel = "mlx-community/Qwen2.5-7B-Instruct-4bit";

    @NotBlank
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Explicit model profile name ("qwen-7b", "llama-3-8b", "default"); blank means auto-detect.
     */
    private String profile = "";

    @Min(1)
    private int timeoutSeconds = 120;

    public String resolvedBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank() ? baseUrl : provider.getDefaultBaseUrl();
    }
}
