package com.helix.guardrails.budget;

import com.helix.guardrails.exception.ConfigurationException;

import java.util.Map;

/**
 * Token-budget and behavior parameters tuned to a model class.
 *
 * <p>The 7B/8B profiles keep prompts inside the window where small local models
 * still answer well; {@link #DEFAULT} fits large hosted models.
 */
public record ModelProfile(
        String name,
        int effectiveContextTokens,
        int maxOutputTokens,
        int promptReserveTokens,
        int chunkTokenLimit,
        int retrievalTopK,
        int jsonRetries,
        boolean useConstrainedJson,
        String embeddingModel,
        boolean simplifyPrompts
) {

    public static final ModelProfile QWEN_7B = new ModelProfile(
            "qwen-7b", 6144, 2048, 4096, 256, 3, 2, true, "all-MiniLM-L6-v2", true);

    public static final ModelProfile LLAMA_3_8B = new ModelProfile(
            "llama-3-8b", 6144, 2048, 4096, 256, 3, 2, true, "all-MiniLM-L6-v2", true);

    public static final ModelProfile DEFAULT = new ModelProfile(
            "default", 128000, 4096, 120000, 512, 5, 0, false, "", false);

    public static final Map<String, ModelProfile> BUILT_IN = Map.of(
            QWEN_7B.name(), QWEN_7B,
            LLAMA_3_8B.name(), LLAMA_3_8B,
            DEFAULT.name(), DEFAULT);

    public ModelProfile {
        if (effectiveContextTokens <= 0 || maxOutputTokens <= 0) {
            throw new ConfigurationException("Model profile " + name + " must have positive token limits");
        }
        if (promptReserveTokens > effectiveContextTokens) {
            throw new ConfigurationException("Model profile " + name + ": prompt reserve ("
                    + promptReserveTokens + ") exceeds effective context (" + effectiveContextTokens + ")");
        }
        if (jsonRetries < 0) {
            throw new ConfigurationException("Model profile " + name + ": json retries cannot be negative");
        }
        embeddingModel = embeddingModel == null ? "" : embeddingModel;
    }

    /**
     * Whether structured calls should ask the backend for JSON-only decoding.
     */
    public boolean requestsConstrainedJson() {
        return simplifyPrompts && useConstrainedJson;
    }
}
