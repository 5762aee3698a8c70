package com.helix.guardrails.model;

import java.util.List;
import java.util.Map;

/**
 * Knowledge subgraph around a project: its documents, the entities they mention,
 * and the project's declared dependencies.
 *
 * @param project      project node properties, or null when the project is unknown
 * @param documents    document node properties
 * @param entities     entity node properties
 * @param dependencies DEPENDS_ON edges out of the project
 */
public record ProjectGraph(Map<String, Object> project,
                           List<Map<String, Object>> documents,
                           List<Map<String, Object>> entities,
                           List<DependencyEdge> dependencies) {

    public static ProjectGraph empty() {
        return new ProjectGraph(null, List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return project == null;
    }
}
