package com.helix.guardrails.knowledge.impl;

import com.helix.guardrails.exception.ResourceNotFoundException;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.DependencyEdge;
import com.helix.guardrails.model.ProjectGraph;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of the knowledge graph.
 *
 * <p>Node model: {@code (:Project {id, name})-[:HAS_DOC]->(:Document {id, title, doc_type})
 * -[:MENTIONS]->(:Entity {name, type})}, plus {@code (:Project)-[:DEPENDS_ON {type,
 * description}]->(:Entity)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Driver driver;

    @Override
    public void ensureIndexes() {
        write("ensureIndexes", "CREATE INDEX project_id IF NOT EXISTS FOR (p:Project) ON (p.id)", Map.of());
        write("ensureIndexes", "CREATE INDEX document_id IF NOT EXISTS FOR (d:Document) ON (d.id)", Map.of());
        write("ensureIndexes", "CREATE INDEX entity_name IF NOT EXISTS FOR (e:Entity) ON (e.name)", Map.of());
        log.info("✅ Neo4j indexes ensured");
    }

    // =========================================================================
    // Generic operations
    // =========================================================================

    @Override
    public void upsertNode(String label, String key, Map<String, Object> properties) {
        String cypher = "MERGE (n:%s {%s: $key}) SET n += $props"
                .formatted(requireIdentifier(label), GraphStore.keyProperty(label));
        write("upsertNode", cypher, Map.of("key", key, "props", nonNullProperties(properties)));
    }

    @Override
    public void upsertEdge(String fromLabel, String fromKey, String toLabel, String toKey,
                           String type, Map<String, Object> properties) {
        String cypher = """
            MATCH (a:%s {%s: $fromKey})
            MATCH (b:%s {%s: $toKey})
            MERGE (a)-[r:%s]->(b)
            SET r += $props
            RETURN count(r) AS linked
            """.formatted(
                requireIdentifier(fromLabel), GraphStore.keyProperty(fromLabel),
                requireIdentifier(toLabel), GraphStore.keyProperty(toLabel),
                requireIdentifier(type));
        Map<String, Object> params = Map.of(
                "fromKey", fromKey, "toKey", toKey, "props", nonNullProperties(properties));

        long linked = writeAndCount("upsertEdge", cypher, params, "linked");
        if (linked == 0) {
            throw new ResourceNotFoundException("Graph edge endpoint",
                    fromLabel + ":" + fromKey + " -[" + type + "]-> " + toLabel + ":" + toKey);
        }
    }

    @Override
    public List<Map<String, Object>> query(String cypher, Map<String, Object> params) {
        return read("query", cypher, params == null ? Map.of() : params, result -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            while (result.hasNext()) {
                rows.add(result.next().asMap());
            }
            return rows;
        });
    }

    // =========================================================================
    // Domain operations
    // =========================================================================

    @Override
    public void addProjectNode(String projectId, String name) {
        write("addProjectNode", "MERGE (p:Project {id: $id}) SET p.name = $name",
                createParams("id", projectId, "name", name));
    }

    @Override
    public void addDocumentNode(String docId, String projectId, String title, String docType) {
        String cypher = """
            MERGE (d:Document {id: $docId})
            SET d.title = $title, d.doc_type = $docType
            WITH d
            MATCH (p:Project {id: $projectId})
            MERGE (p)-[:HAS_DOC]->(d)
            """;
        write("addDocumentNode", cypher, createParams(
                "docId", docId,
                "projectId", projectId,
                "title", title,
                "docType", docType));
    }

    @Override
    public void addEntity(String entityName, String entityType, String docId) {
        String cypher = """
            MERGE (e:Entity {name: $name})
            SET e.type = $type
            WITH e
            MATCH (d:Document {id: $docId})
            MERGE (d)-[:MENTIONS]->(e)
            """;
        write("addEntity", cypher, createParams("name", entityName, "type", entityType, "docId", docId));
    }

    @Override
    public void addDependency(String projectId, String targetEntity, String dependencyType, String description) {
        String cypher = """
            MATCH (p:Project {id: $projectId})
            MERGE (e:Entity {name: $entity})
            MERGE (p)-[r:DEPENDS_ON]->(e)
            SET r.type = $depType, r.description = $description
            """;
        write("addDependency", cypher, createParams(
                "projectId", projectId,
                "entity", targetEntity,
                "depType", dependencyType,
                "description", description));
    }

    @Override
    public ProjectGraph getProjectGraph(String projectId) {
        String cypher = """
            MATCH (p:Project {id: $projectId})
            OPTIONAL MATCH (p)-[:HAS_DOC]->(d:Document)
            OPTIONAL MATCH (d)-[:MENTIONS]->(e:Entity)
            OPTIONAL MATCH (p)-[dep:DEPENDS_ON]->(target:Entity)
            RETURN p,
                   collect(DISTINCT d) AS docs,
                   collect(DISTINCT e) AS entities,
                   collect(DISTINCT {target: target.name, type: dep.type, description: dep.description}) AS deps
            """;
        return read("getProjectGraph", cypher, Map.of("projectId", projectId), result -> {
            if (!result.hasNext()) {
                return ProjectGraph.empty();
            }
            return toProjectGraph(projectId, result.next());
        });
    }

    @Override
    public List<Map<String, Object>> getEntityContext(String entityName) {
        String cypher = """
            MATCH (e:Entity {name: $name})<-[:MENTIONS]-(d:Document)<-[:HAS_DOC]-(p:Project)
            RETURN p.id AS project_id, p.name AS project_name, d.id AS doc_id, d.title AS doc_title
            """;
        return query(cypher, Map.of("name", entityName));
    }

    private ProjectGraph toProjectGraph(String projectId, Record record) {
        Map<String, Object> project = record.get("p").asNode().asMap();
        List<Map<String, Object>> documents = record.get("docs").asList(v -> v.asNode().asMap());
        List<Map<String, Object>> entities = record.get("entities").asList(v -> v.asNode().asMap());

        List<DependencyEdge> dependencies = new ArrayList<>();
        for (Value dep : record.get("deps").values()) {
            if (dep.get("target").isNull()) {
                continue;
            }
            dependencies.add(new DependencyEdge(
                    projectId,
                    dep.get("target").asString(),
                    dep.get("type").isNull() ? "" : dep.get("type").asString(),
                    dep.get("description").isNull() ? "" : dep.get("description").asString()));
        }
        return new ProjectGraph(project, documents, entities, dependencies);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void write(String operation, String cypher, Map<String, Object> params) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest(ExternalCallLogger.singleLine(cypher, 200));
        try (Session session = driver.session()) {
            session.executeWrite(tx -> {
                tx.run(cypher, params);
                return null;
            });
            ctx.logResponse(null);
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.NEO4J, "Neo4j " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private long writeAndCount(String operation, String cypher, Map<String, Object> params, String column) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest(ExternalCallLogger.singleLine(cypher, 200));
        try (Session session = driver.session()) {
            long count = session.executeWrite(tx -> tx.run(cypher, params).single().get(column).asLong());
            ctx.logResponse(null, column, count);
            return count;
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.NEO4J, "Neo4j " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private <T> T read(String operation, String cypher, Map<String, Object> params, ResultMapper<T> mapper) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest(ExternalCallLogger.singleLine(cypher, 200));
        try (Session session = driver.session()) {
            T value = session.executeRead(tx -> mapper.map(tx.run(cypher, params)));
            ctx.logResponse(null);
            return value;
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.NEO4J, "Neo4j " + operation + " failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ResultMapper<T> {
        T map(Result result);
    }

    static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid graph label or relationship type: " + name);
        }
        return name;
    }

    private static Map<String, Object> nonNullProperties(Map<String, Object> properties) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((k, v) -> {
                if (v != null) {
                    props.put(k, v);
                }
            });
        }
        return props;
    }

    private Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            params.put(key, value != null ? value : "");
        }
        return params;
    }
}
