package com.helix.guardrails.query;

import com.helix.guardrails.budget.ModelProfile;
import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.knowledge.EmbeddingService;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.knowledge.MetadataFilter;
import com.helix.guardrails.knowledge.VectorStore;
import com.helix.guardrails.model.ProjectGraph;
import com.helix.guardrails.model.RetrievalResult;
import com.helix.guardrails.model.VectorMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Hybrid Retriever Tests")
class HybridRetrieverTest {

    private static final List<Double> VECTOR = List.of(0.1, 0.2, 0.3);

    @Mock
    private EmbeddingService embeddingService;

    @Mock
    private VectorStore vectorStore;

    @Mock
    private GraphStore graphStore;

    @Mock
    private ModelProfileResolver profileResolver;

    private HybridRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new HybridRetriever(embeddingService, vectorStore, graphStore, profileResolver);
    }

    private static VectorMatch match(String content, double distance) {
        return new VectorMatch("id-" + content, content, Map.of("title", "T"), distance);
    }

    @Test
    @DisplayName("Similarity is one minus distance and null filters are dropped")
    void retrieveSimilar_ShouldConvertDistances() {
        // Given
        when(embeddingService.embed("payments")).thenReturn(VECTOR);
        when(vectorStore.query(eq(VectorStore.DOCUMENTS), eq(VECTOR), eq(5), any()))
                .thenReturn(List.of(match("a", 0.1), match("b", 0.4)));

        // When
        List<RetrievalResult> results = retriever.retrieveSimilar("payments", "p1", null, 5);

        // Then
        assertThat(results).extracting(RetrievalResult::content).containsExactly("a", "b");
        assertThat(results.get(0).similarity()).isEqualTo(0.9);

        ArgumentCaptor<MetadataFilter> filter = ArgumentCaptor.forClass(MetadataFilter.class);
        verify(vectorStore).query(anyString(), any(), anyInt(), filter.capture());
        assertThat(filter.getValue().conditions()).containsOnlyKeys("project_id");
    }

    @Test
    @DisplayName("Design doc prefers technical_design chunks joined by a rule")
    void retrieveDesignDoc_TechnicalDesignFound_ShouldJoinChunks() {
        // Given
        when(embeddingService.embed(HybridRetriever.DESIGN_QUERY)).thenReturn(VECTOR);
        when(vectorStore.query(eq(VectorStore.DOCUMENTS), eq(VECTOR), eq(3),
                argThat(f -> "technical_design".equals(f.conditions().get("doc_type")))))
                .thenReturn(List.of(match("Part one", 0.2), match("Part two", 0.3)));

        // When
        Optional<String> design = retriever.retrieveDesignDoc("p1", 3);

        // Then
        assertThat(design).contains("Part one\n\n---\n\nPart two");
    }

    @Test
    @DisplayName("Without technical_design chunks any document type is searched")
    void retrieveDesignDoc_NoTechnicalDesign_ShouldFallBack() {
        // Given
        when(embeddingService.embed(anyString())).thenReturn(VECTOR);
        when(vectorStore.query(eq(VectorStore.DOCUMENTS), eq(VECTOR), eq(5), any()))
                .thenReturn(List.of())
                .thenReturn(List.of(match("PRD section", 0.5)));
        when(profileResolver.activeProfile()).thenReturn(ModelProfile.DEFAULT);

        // When
        Optional<String> design = retriever.retrieveDesignDoc("p1");

        // Then
        assertThat(design).contains("PRD section");
        verify(embeddingService).embed(HybridRetriever.FALLBACK_DESIGN_QUERY);
    }

    @Test
    @DisplayName("No chunks at all means no design doc")
    void retrieveDesignDoc_NothingIndexed_ShouldBeEmpty() {
        when(embeddingService.embed(anyString())).thenReturn(VECTOR);
        when(vectorStore.query(anyString(), any(), anyInt(), any())).thenReturn(List.of());

        assertThat(retriever.retrieveDesignDoc("p1", 3)).isEmpty();
    }

    @Test
    @DisplayName("Repo context is looked up by URL in the repo-map collection")
    void retrieveRepoContext_ShouldFetchById() {
        when(vectorStore.get(VectorStore.REPO_MAPS, "https://github.com/acme/billing"))
                .thenReturn(Optional.of(new VectorMatch("https://github.com/acme/billing", "Repository: acme", Map.of(), 0)));

        assertThat(retriever.retrieveRepoContext("https://github.com/acme/billing")).contains("Repository: acme");
    }

    @Test
    @DisplayName("Blank repo URL skips the lookup")
    void retrieveRepoContext_BlankUrl_ShouldBeEmpty() {
        assertThat(retriever.retrieveRepoContext(" ")).isEmpty();
        verifyNoInteractions(vectorStore);
    }

    @Test
    @DisplayName("Graph context combines vector hits with the project subgraph")
    void retrieveWithGraphContext_ShouldCombineSources() {
        ProjectGraph graph = new ProjectGraph(Map.of("id", "p1"), List.of(), List.of(), List.of());
        when(embeddingService.embed("auth")).thenReturn(VECTOR);
        when(vectorStore.query(anyString(), any(), anyInt(), any())).thenReturn(List.of(match("auth chunk", 0.2)));
        when(graphStore.getProjectGraph("p1")).thenReturn(graph);

        GraphContextResult result = retriever.retrieveWithGraphContext("auth", "p1", 4);

        assertThat(result.vectorResults()).hasSize(1);
        assertThat(result.graphContext()).isSameAs(graph);
    }
}
