package com.helix.guardrails.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One embedded slice of a source document. Re-indexing the same document
 * overwrites chunks by id.
 */
@Value
@Builder
public class DocumentChunk {
    String sourceDocId;
    int index;
    String text;
    List<Double> vector;
    Map<String, Object> metadata;

    public String getId() {
        return idFor(sourceDocId, index);
    }

    public static String idFor(String docId, int index) {
        return docId + "_" + index;
    }
}
