package com.helix.guardrails.knowledge;

import com.helix.guardrails.model.ProjectGraph;

import java.util.List;
import java.util.Map;

/**
 * Knowledge graph of projects, documents, entities and dependencies.
 *
 * <p>All writes are idempotent merges. Labels and relationship types must be plain
 * identifiers; anything else is rejected with {@link IllegalArgumentException}.
 * Connectivity failures surface as
 * {@link com.helix.guardrails.exception.TransientIoException}.
 */
public interface GraphStore {

    String ENTITY_LABEL = "Entity";

    // =========================================================================
    // Generic operations
    // =========================================================================

    /**
     * Merge a node on its label's key property (see {@link #keyProperty}) and overwrite
     * the given properties.
     */
    void upsertNode(String label, String key, Map<String, Object> properties);

    /**
     * Merge a relationship between two existing nodes, each matched by label and key,
     * and overwrite its properties.
     *
     * @throws com.helix.guardrails.exception.ResourceNotFoundException if either endpoint is missing
     */
    void upsertEdge(String fromLabel, String fromKey, String toLabel, String toKey,
                    String type, Map<String, Object> properties);

    /**
     * Run a read query and return its rows.
     */
    List<Map<String, Object>> query(String cypher, Map<String, Object> params);

    void ensureIndexes();

    /**
     * Merge key of a label: entities are keyed by {@code name}, everything else by {@code id}.
     */
    static String keyProperty(String label) {
        return ENTITY_LABEL.equals(label) ? "name" : "id";
    }

    // =========================================================================
    // Domain operations
    // =========================================================================

    void addProjectNode(String projectId, String name);

    /**
     * Merge a document and link it to its project with HAS_DOC.
     */
    void addDocumentNode(String docId, String projectId, String title, String docType);

    /**
     * Merge an entity by name and link the document to it with MENTIONS.
     */
    void addEntity(String entityName, String entityType, String docId);

    /**
     * Merge a DEPENDS_ON edge from a project to an entity; type and description are overwritten.
     */
    void addDependency(String projectId, String targetEntity, String dependencyType, String description);

    ProjectGraph getProjectGraph(String projectId);

    /**
     * Projects and documents that mention an entity.
     *
     * @return rows with project_id, project_name, doc_id, doc_title
     */
    List<Map<String, Object>> getEntityContext(String entityName);
}
