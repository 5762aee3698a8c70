package com.helix.guardrails.knowledge;

import java.util.List;

/**
 * Turns text into dense vectors for similarity search.
 *
 * <p>Any backend failure surfaces as a
 * {@link com.helix.guardrails.exception.TransientIoException} and fails the ingest step;
 * there is no partial result.
 */
public interface EmbeddingService {

    /**
     * Embed a single text (typically a search query).
     */
    List<Double> embed(String text);

    /**
     * Embed many texts in one backend call.
     *
     * @param texts texts to embed
     * @return one vector per input, same order
     */
    List<List<Double>> embedBatch(List<String> texts);
}
