package com.helix.guardrails.knowledge;

import com.helix.guardrails.model.VectorMatch;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named collections of embedded text with metadata.
 *
 * <p>Writes are upserts keyed by id. Failures surface as
 * {@link com.helix.guardrails.exception.TransientIoException}.
 */
public interface VectorStore {

    String DOCUMENTS = "helix_documents";
    String REPO_MAPS = "helix_repo_maps";

    /**
     * Upsert parallel lists of ids, texts, vectors and metadata into a collection.
     */
    void add(String collection,
             List<String> ids,
             List<String> texts,
             List<List<Double>> vectors,
             List<Map<String, Object>> metadatas);

    /**
     * Nearest neighbours of {@code vector}, closest first.
     *
     * @param k      maximum number of matches
     * @param filter equality conditions, {@link MetadataFilter#none()} for no filter
     */
    List<VectorMatch> query(String collection, List<Double> vector, int k, MetadataFilter filter);

    Optional<VectorMatch> get(String collection, String id);

    /**
     * Stores a repository's file tree and signatures as one entry keyed by the repository URL.
     */
    void addRepoMap(String repoUrl, String fileTree, String signatures, List<Double> vector);

    static String repoMapContent(String repoUrl, String fileTree, String signatures) {
        return "Repository: " + repoUrl + "\n\nFile Tree:\n" + fileTree + "\n\nSignatures:\n" + signatures;
    }
}
