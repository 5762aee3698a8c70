package com.helix.guardrails.configuration;

import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.client.LlmProviderType;
import com.helix.guardrails.knowledge.impl.GeminiEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;

/**
 * Chooses the embedding backend.
 *
 * <p>The profile's local model runs in-process; otherwise the configured provider's
 * embedding endpoint is used.
 */
@Slf4j
@Configuration
public class EmbeddingModelConfiguration {

    public static final String LOCAL_MINILM = "all-MiniLM-L6-v2";

    @Bean
    public EmbeddingModel embeddingModel(AppProperties props, ModelProfileResolver profiles) {
        LlmProperties llm = props.getLlm();
        String modelName = profiles.resolvedEmbeddingModel();
        Duration timeout = Duration.ofSeconds(llm.getTimeoutSeconds());

        if (isLocalMiniLm(modelName)) {
            log.info("🟣 Embeddings: in-process {}", LOCAL_MINILM);
            return new AllMiniLmL6V2EmbeddingModel();
        }

        log.info("🟣 Embeddings: {} via {} at {}", modelName, llm.getProvider(), llm.resolvedBaseUrl());
        if (llm.getProvider() == LlmProviderType.OLLAMA) {
            return OllamaEmbeddingModel.builder()
                    .baseUrl(llm.resolvedBaseUrl())
                    .modelName(modelName)
                    .timeout(timeout)
                    .maxRetries(0)
                    .build();
        }
        if (llm.getProvider() == LlmProviderType.GEMINI) {
            return new GeminiEmbeddingModel(llm.resolvedBaseUrl(), llm.getApiKey(), modelName, timeout);
        }
        return OpenAiEmbeddingModel.builder()
                .baseUrl(llm.resolvedBaseUrl() + "/v1")
                .apiKey(llm.getApiKey() == null || llm.getApiKey().isBlank() ? "unused" : llm.getApiKey())
                .modelName(modelName)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    static boolean isLocalMiniLm(String modelName) {
        return modelName != null && modelName.toLowerCase(Locale.ROOT).endsWith(LOCAL_MINILM.toLowerCase(Locale.ROOT));
    }
}
