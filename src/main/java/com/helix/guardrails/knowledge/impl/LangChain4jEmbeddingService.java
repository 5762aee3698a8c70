package com.helix.guardrails.knowledge.impl;

import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.knowledge.EmbeddingService;
import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding service backed by whichever LangChain4j {@link EmbeddingModel} the
 * configuration selected. Retries and timeouts are the model's own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "embedAll", log);
        ctx.logRequest(null, "Texts", texts.size());

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .toList();

        Response<List<Embedding>> response;
        try {
            response = embeddingModel.embedAll(segments);
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.EMBEDDING,
                    "Embedding failed for " + texts.size() + " texts: " + e.getMessage(), e);
        }

        List<Embedding> embeddings = response == null || response.content() == null
                ? List.of()
                : response.content();
        if (embeddings.size() != texts.size()) {
            ctx.logError("expected " + texts.size() + " vectors, got " + embeddings.size(), null);
            throw new TransientIoException(ServiceType.EMBEDDING,
                    "Embedding backend returned " + embeddings.size() + " vectors for " + texts.size() + " texts");
        }

        List<List<Double>> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(toDoubleList(embedding));
        }
        ctx.logResponse(null, "Vectors", vectors.size(), "Dimensions", vectors.get(0).size());
        return vectors;
    }

    private List<Double> toDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float v : vector) {
            result.add((double) v);
        }
        return result;
    }
}
