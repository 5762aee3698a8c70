package com.helix.guardrails.knowledge;

/**
 * Outcome of indexing one document.
 *
 * @param docId    indexed document
 * @param chunks   chunks written to the vector store
 * @param entities entities written to the graph
 */
public record IndexingResult(String docId, int chunks, int entities) {
}
