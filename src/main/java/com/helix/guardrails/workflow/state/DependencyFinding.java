package com.helix.guardrails.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dependency the model found in a PRD; written to the graph as DEPENDS_ON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DependencyFinding {
    private String target;
    /** hard or soft */
    private String type;
    private String description;
}
