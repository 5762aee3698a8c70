package com.helix.guardrails.knowledge.impl;

import com.helix.guardrails.exception.ResourceNotFoundException;
import com.helix.guardrails.exception.TransientIoException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Neo4j Graph Store Tests")
class Neo4jGraphStoreImplTest {

    @Mock
    private Driver driver;

    @Mock
    private Session session;

    @Mock
    private TransactionContext tx;

    private Neo4jGraphStoreImpl graphStore;

    @BeforeEach
    void setUp() {
        graphStore = new Neo4jGraphStoreImpl(driver);
    }

    private void stubWrites() {
        when(driver.session()).thenReturn(session);
        when(session.executeWrite(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.execute(tx);
        });
    }

    private void stubReads() {
        when(driver.session()).thenReturn(session);
        when(session.executeRead(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.execute(tx);
        });
    }

    @Test
    @DisplayName("Entity upsert merges on name and links the document")
    @SuppressWarnings("unchecked")
    void addEntity_ShouldRunMergeWithParams() {
        // Given
        stubWrites();

        // When
        graphStore.addEntity("Payments Team", "team", "doc-1");

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(cypher.capture(), params.capture());
        assertThat(cypher.getValue()).contains("MERGE (e:Entity {name: $name})").contains("[:MENTIONS]");
        assertThat(params.getValue())
                .containsEntry("name", "Payments Team")
                .containsEntry("type", "team")
                .containsEntry("docId", "doc-1");
        verify(session).close();
    }

    @Test
    @DisplayName("Null parameters are stored as empty strings")
    @SuppressWarnings("unchecked")
    void addDocumentNode_NullTitle_ShouldUseEmptyString() {
        stubWrites();

        graphStore.addDocumentNode("doc-1", "p1", null, "prd");

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(anyString(), params.capture());
        assertThat(params.getValue()).containsEntry("title", "");
    }

    @Test
    @DisplayName("Index creation runs one statement per index")
    void ensureIndexes_ShouldCreateThreeIndexes() {
        stubWrites();

        graphStore.ensureIndexes();

        verify(tx, times(3)).run(anyString(), anyMap());
    }

    @Test
    @DisplayName("Labels that are not plain identifiers are rejected without a query")
    void upsertNode_InvalidLabel_ShouldThrow() {
        assertThatThrownBy(() -> graphStore.upsertNode("Project) DETACH DELETE (n", "p1", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> graphStore.upsertEdge("Project", "a", "Entity", "b", "DEPENDS-ON", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(driver);
    }

    @Test
    @DisplayName("Valid label is interpolated into the MERGE")
    void upsertNode_ValidLabel_ShouldMerge() {
        stubWrites();

        graphStore.upsertNode("Project", "p1", Map.of("name", "Checkout"));

        verify(tx).run(org.mockito.ArgumentMatchers.startsWith("MERGE (n:Project {id: $key})"), anyMap());
    }

    @Test
    @DisplayName("Connectivity failure surfaces as a transient I/O error")
    void addProjectNode_Unavailable_ShouldWrap() {
        when(driver.session()).thenReturn(session);
        when(session.executeWrite(any())).thenThrow(new ServiceUnavailableException("no route"));

        assertThatThrownBy(() -> graphStore.addProjectNode("p1", "Checkout"))
                .isInstanceOf(TransientIoException.class)
                .hasMessageContaining("no route");
    }

    @Test
    @DisplayName("Entity context returns one row per mentioning document")
    void getEntityContext_ShouldReturnRows() {
        // Given
        stubReads();
        Result result = mock(Result.class);
        Record record = mock(Record.class);
        when(tx.run(anyString(), anyMap())).thenReturn(result);
        when(result.hasNext()).thenReturn(true, false);
        when(result.next()).thenReturn(record);
        when(record.asMap()).thenReturn(Map.of("project_id", "p1", "doc_id", "doc-1"));

        // When
        List<Map<String, Object>> rows = graphStore.getEntityContext("Kafka");

        // Then
        assertThat(rows).containsExactly(Map.of("project_id", "p1", "doc_id", "doc-1"));
    }

    @Test
    @DisplayName("Unknown project yields an empty graph")
    void getProjectGraph_UnknownProject_ShouldBeEmpty() {
        stubReads();
        Result result = mock(Result.class);
        when(tx.run(anyString(), anyMap())).thenReturn(result);
        when(result.hasNext()).thenReturn(false);

        assertThat(graphStore.getProjectGraph("missing").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Entity nodes merge on name, the same key the domain writes use")
    @SuppressWarnings("unchecked")
    void upsertNode_Entity_ShouldMergeOnName() {
        // Given
        stubWrites();

        // When
        graphStore.upsertNode("Entity", "Privacy Team", Map.of("type", "team"));

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(cypher.capture(), params.capture());
        assertThat(cypher.getValue()).startsWith("MERGE (n:Entity {name: $key})");
        assertThat(params.getValue()).containsEntry("key", "Privacy Team");
    }

    @Test
    @DisplayName("Edges match both endpoints by label and key")
    @SuppressWarnings("unchecked")
    void upsertEdge_ProjectToEntity_ShouldMatchLabelledEndpoints() {
        // Given
        stubWrites();
        Result result = mock(Result.class);
        Record record = mock(Record.class);
        when(tx.run(anyString(), anyMap())).thenReturn(result);
        when(result.single()).thenReturn(record);
        when(record.get("linked")).thenReturn(Values.value(1L));

        // When
        graphStore.upsertEdge("Project", "p1", "Entity", "Privacy Team", "DEPENDS_ON",
                Map.of("type", "approval"));

        // Then
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(cypher.capture(), params.capture());
        assertThat(cypher.getValue())
                .contains("MATCH (a:Project {id: $fromKey})")
                .contains("MATCH (b:Entity {name: $toKey})")
                .contains("MERGE (a)-[r:DEPENDS_ON]->(b)");
        assertThat(params.getValue())
                .containsEntry("fromKey", "p1")
                .containsEntry("toKey", "Privacy Team");
    }

    @Test
    @DisplayName("An edge to a missing node is reported, not silently dropped")
    void upsertEdge_MissingEndpoint_ShouldThrowNotFound() {
        // Given
        stubWrites();
        Result result = mock(Result.class);
        Record record = mock(Record.class);
        when(tx.run(anyString(), anyMap())).thenReturn(result);
        when(result.single()).thenReturn(record);
        when(record.get("linked")).thenReturn(Values.value(0L));

        // When / Then
        assertThatThrownBy(() -> graphStore.upsertEdge("Document", "doc-9", "Entity", "Kafka", "MENTIONS", Map.of()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Document:doc-9");
    }
}
