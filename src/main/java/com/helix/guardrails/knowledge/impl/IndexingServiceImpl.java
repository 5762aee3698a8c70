package com.helix.guardrails.knowledge.impl;

import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.knowledge.DocumentChunker;
import com.helix.guardrails.knowledge.EmbeddingService;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.knowledge.IndexingResult;
import com.helix.guardrails.knowledge.IndexingService;
import com.helix.guardrails.knowledge.VectorStore;
import com.helix.guardrails.model.DocumentChunk;
import com.helix.guardrails.model.ExtractedEntity;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.parser.EntityExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingest pipeline: chunk → embed → vector upsert → document node → entities.
 *
 * <p>Steps up to the vector upsert are mandatory and their failures propagate. Graph
 * enrichment afterwards is best-effort.
 */
@Slf4j
@Service
public class IndexingServiceImpl implements IndexingService {

    private final DocumentChunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final EntityExtractor entityExtractor;

    public IndexingServiceImpl(ModelProfileResolver profileResolver,
                               EmbeddingService embeddingService,
                               VectorStore vectorStore,
                               GraphStore graphStore,
                               EntityExtractor entityExtractor) {
        this.chunker = DocumentChunker.forProfile(profileResolver.activeProfile());
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.graphStore = graphStore;
        this.entityExtractor = entityExtractor;
        log.info("Indexing with chunk size {} / overlap {}", chunker.getChunkSize(), chunker.getChunkOverlap());
    }

    @Override
    public IndexingResult indexDocument(String docId, String projectId, String title, String docType, String content) {
        List<String> texts = chunker.split(content);
        log.info("Split document {} into {} chunks", docId, texts.size());

        List<List<Double>> vectors = embeddingService.embedBatch(texts);
        if (vectors.size() != texts.size()) {
            throw new TransientIoException(ServiceType.EMBEDDING,
                    "Got " + vectors.size() + " embeddings for " + texts.size() + " chunks of " + docId);
        }

        List<DocumentChunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("project_id", projectId);
            metadata.put("doc_id", docId);
            metadata.put("doc_type", docType);
            metadata.put("title", title);
            metadata.put("chunk_index", i);
            chunks.add(DocumentChunk.builder()
                    .sourceDocId(docId)
                    .index(i)
                    .text(texts.get(i))
                    .vector(vectors.get(i))
                    .metadata(metadata)
                    .build());
        }

        vectorStore.add(VectorStore.DOCUMENTS,
                chunks.stream().map(DocumentChunk::getId).toList(),
                chunks.stream().map(DocumentChunk::getText).toList(),
                chunks.stream().map(DocumentChunk::getVector).toList(),
                chunks.stream().map(DocumentChunk::getMetadata).toList());

        try {
            graphStore.addDocumentNode(docId, projectId, title, docType);
        } catch (RuntimeException e) {
            log.warn("Failed to create graph node for doc {}: {}", docId, e.getMessage());
        }

        List<ExtractedEntity> entities = entityExtractor.extractAndStore(content, docId);

        log.info("✅ Indexed doc {}: {} chunks, {} entities", docId, chunks.size(), entities.size());
        return new IndexingResult(docId, chunks.size(), entities.size());
    }

    @Override
    public void indexRepoMap(String repoUrl, String fileTree, List<String> signatures) {
        String signatureText = String.join("\n", signatures);
        String content = VectorStore.repoMapContent(repoUrl, fileTree, signatureText);
        List<Double> vector = embeddingService.embed(content);
        vectorStore.addRepoMap(repoUrl, fileTree, signatureText, vector);
        log.info("Indexed repo map for {} ({} signatures)", repoUrl, signatures.size());
    }
}
