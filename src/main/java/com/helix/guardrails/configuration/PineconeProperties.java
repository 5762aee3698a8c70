package com.helix.guardrails.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Pinecone connection. Collections are namespaces of the one index; a non-empty
 * {@code namespacePrefix} lets several environments share it.
 */
@Data
public class PineconeProperties {

    @NotBlank
    private String apiKey;

    @NotBlank
    private String indexName;

    @NotNull
    private String namespacePrefix = "";

    @Positive
    private int upsertBatchSize = 100;
}
