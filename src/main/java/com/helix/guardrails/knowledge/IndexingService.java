package com.helix.guardrails.knowledge;

import java.util.List;

/**
 * Ingest side of the knowledge layer: chunk, embed and store documents, and record
 * their entities in the graph.
 */
public interface IndexingService {

    /**
     * Index one document. Re-indexing the same id overwrites its chunks.
     *
     * <p>Vector-side failures propagate; graph enrichment is best-effort.
     */
    IndexingResult indexDocument(String docId, String projectId, String title, String docType, String content);

    /**
     * Index a repository's file tree and signature summary for later lookup by URL.
     */
    void indexRepoMap(String repoUrl, String fileTree, List<String> signatures);
}
