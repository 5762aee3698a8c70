package com.helix.guardrails.query;

import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.knowledge.EmbeddingService;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.knowledge.MetadataFilter;
import com.helix.guardrails.knowledge.VectorStore;
import com.helix.guardrails.model.ProjectGraph;
import com.helix.guardrails.model.RetrievalResult;
import com.helix.guardrails.model.VectorMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembles grounding context from semantic search over document chunks and from the
 * knowledge graph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HybridRetriever {

    static final String DESIGN_DOC_TYPE = "technical_design";
    static final String DESIGN_QUERY = "technical design architecture specification";
    static final String FALLBACK_DESIGN_QUERY = "design specification requirements";
    static final String DOC_SEPARATOR = "\n\n---\n\n";

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final ModelProfileResolver profileResolver;

    /**
     * Semantic search over indexed document chunks.
     *
     * @param filters metadata equalities (e.g. project_id, doc_type); null values are ignored
     * @param k       maximum number of results
     */
    public List<RetrievalResult> retrieveSimilar(String query, Map<String, String> filters, int k) {
        List<Double> queryVector = embeddingService.embed(query);
        List<VectorMatch> matches = vectorStore.query(VectorStore.DOCUMENTS, queryVector, k, MetadataFilter.of(filters));
        log.debug("Retrieved {} chunks for query '{}' with filters {}", matches.size(), query, filters);
        return matches.stream()
                .map(RetrievalResult::from)
                .toList();
    }

    public List<RetrievalResult> retrieveSimilar(String query, String projectId, String docType, int k) {
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("project_id", projectId);
        filters.put("doc_type", docType);
        return retrieveSimilar(query, filters, k);
    }

    public Optional<String> retrieveDesignDoc(String projectId) {
        return retrieveDesignDoc(projectId, profileResolver.activeProfile().retrievalTopK());
    }

    /**
     * The project's design context: technical-design chunks if any exist, otherwise the
     * chunks of any document type that best match a design query. Chunks are joined with
     * a horizontal-rule separator.
     */
    public Optional<String> retrieveDesignDoc(String projectId, int topK) {
        List<RetrievalResult> results = retrieveSimilar(DESIGN_QUERY, projectId, DESIGN_DOC_TYPE, topK);
        if (results.isEmpty()) {
            log.debug("No technical_design chunks for project {}, falling back to any document type", projectId);
            results = retrieveSimilar(FALLBACK_DESIGN_QUERY, projectId, null, topK);
        }
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(results.stream()
                .map(RetrievalResult::content)
                .collect(Collectors.joining(DOC_SEPARATOR)));
    }

    /**
     * Stored repository map for a repository URL.
     */
    public Optional<String> retrieveRepoContext(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            return Optional.empty();
        }
        return vectorStore.get(VectorStore.REPO_MAPS, repoUrl).map(VectorMatch::content);
    }

    public GraphContextResult retrieveWithGraphContext(String query, String projectId, int k) {
        List<RetrievalResult> vectorResults = retrieveSimilar(query, projectId, null, k);
        ProjectGraph graph = graphStore.getProjectGraph(projectId);
        return new GraphContextResult(vectorResults, graph);
    }
}
