package com.helix.guardrails.knowledge.impl;

import com.helix.guardrails.budget.ModelProfile;
import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.knowledge.EmbeddingService;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.knowledge.IndexingResult;
import com.helix.guardrails.knowledge.VectorStore;
import com.helix.guardrails.model.EntityType;
import com.helix.guardrails.model.ExtractedEntity;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.parser.EntityExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Indexing Service Tests")
class IndexingServiceImplTest {

    @Mock
    private ModelProfileResolver profileResolver;

    @Mock
    private EmbeddingService embeddingService;

    @Mock
    private VectorStore vectorStore;

    @Mock
    private GraphStore graphStore;

    @Mock
    private EntityExtractor entityExtractor;

    private IndexingServiceImpl indexingService;

    @BeforeEach
    void setUp() {
        when(profileResolver.activeProfile()).thenReturn(ModelProfile.QWEN_7B);
        indexingService = new IndexingServiceImpl(profileResolver, embeddingService, vectorStore, graphStore, entityExtractor);
    }

    @Test
    @DisplayName("Document is chunked, embedded, stored and linked in the graph")
    @SuppressWarnings("unchecked")
    void indexDocument_ShouldRunFullPipeline() {
        // Given
        String content = "Checkout v2 design.\n\nThe Payments Team owns the Stripe API integration.";
        when(embeddingService.embedBatch(anyList())).thenReturn(List.of(List.of(0.1, 0.2)));
        when(entityExtractor.extractAndStore(content, "doc-1"))
                .thenReturn(List.of(new ExtractedEntity("Payments Team", EntityType.TEAM)));

        // When
        IndexingResult result = indexingService.indexDocument("doc-1", "p1", "Checkout v2", "technical_design", content);

        // Then
        assertThat(result).isEqualTo(new IndexingResult("doc-1", 1, 1));

        ArgumentCaptor<List<String>> ids = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<Map<String, Object>>> metadatas = ArgumentCaptor.forClass(List.class);
        verify(vectorStore).add(eq(VectorStore.DOCUMENTS), ids.capture(), anyList(), anyList(), metadatas.capture());
        assertThat(ids.getValue()).containsExactly("doc-1_0");
        assertThat(metadatas.getValue().get(0))
                .containsEntry("project_id", "p1")
                .containsEntry("doc_type", "technical_design")
                .containsEntry("title", "Checkout v2")
                .containsEntry("chunk_index", 0);
        verify(graphStore).addDocumentNode("doc-1", "p1", "Checkout v2", "technical_design");
    }

    @Test
    @DisplayName("Graph node failure does not stop entity extraction")
    void indexDocument_GraphFailure_ShouldContinue() {
        when(embeddingService.embedBatch(anyList())).thenReturn(List.of(List.of(0.1)));
        doThrow(new TransientIoException(ServiceType.NEO4J, "down"))
                .when(graphStore).addDocumentNode(anyString(), anyString(), anyString(), anyString());
        when(entityExtractor.extractAndStore(anyString(), eq("doc-2"))).thenReturn(List.of());

        IndexingResult result = indexingService.indexDocument("doc-2", "p1", "PRD", "prd", "Short PRD text.");

        assertThat(result.chunks()).isEqualTo(1);
        verify(entityExtractor).extractAndStore("Short PRD text.", "doc-2");
    }

    @Test
    @DisplayName("Embedding count mismatch aborts before the vector upsert")
    void indexDocument_EmbeddingMismatch_ShouldThrow() {
        when(embeddingService.embedBatch(anyList())).thenReturn(List.of());

        assertThatThrownBy(() -> indexingService.indexDocument("doc-3", "p1", "PRD", "prd", "Some text."))
                .isInstanceOf(TransientIoException.class);
        verify(vectorStore, never()).add(anyString(), anyList(), anyList(), anyList(), anyList());
    }

    @Test
    @DisplayName("Repo map is embedded as one document keyed by URL")
    void indexRepoMap_ShouldEmbedAndStore() {
        String expected = VectorStore.repoMapContent("https://github.com/acme/billing", "src/\n  App.java",
                "class App\nvoid run()");
        when(embeddingService.embed(expected)).thenReturn(List.of(0.3, 0.4));

        indexingService.indexRepoMap("https://github.com/acme/billing", "src/\n  App.java",
                List.of("class App", "void run()"));

        verify(vectorStore).addRepoMap(eq("https://github.com/acme/billing"), eq("src/\n  App.java"),
                eq("class App\nvoid run()"), any());
    }
}
