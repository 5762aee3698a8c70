package com.helix.guardrails.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LangChain4j {@link EmbeddingModel} over Gemini's {@code batchEmbedContents} endpoint.
 */
public class GeminiEmbeddingModel implements EmbeddingModel {

    private final WebClient webClient;
    private final String modelName;
    private final Duration timeout;

    public GeminiEmbeddingModel(String baseUrl, String apiKey, String modelName, Duration timeout) {
        this(WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .build(), modelName, timeout);
    }

    GeminiEmbeddingModel(WebClient webClient, String modelName, Duration timeout) {
        this.webClient = webClient;
        this.modelName = modelName;
        this.timeout = timeout;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        List<Map<String, Object>> requests = segments.stream()
                .map(s -> Map.<String, Object>of(
                        "model", "models/" + modelName,
                        "content", Map.of("parts", List.of(Map.of("text", s.text())))))
                .toList();

        JsonNode response = webClient.post()
                .uri("/v1beta/models/{model}:batchEmbedContents", modelName)
                .bodyValue(Map.of("requests", requests))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);

        List<Embedding> embeddings = new ArrayList<>();
        if (response != null) {
            for (JsonNode node : response.path("embeddings")) {
                JsonNode values = node.path("values");
                float[] vector = new float[values.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = (float) values.get(i).asDouble();
                }
                embeddings.add(Embedding.from(vector));
            }
        }
        return Response.from(embeddings);
    }
}
