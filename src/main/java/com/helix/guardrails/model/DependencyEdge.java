package com.helix.guardrails.model;

/**
 * Project-to-entity dependency. Re-adding the same pair overwrites type and description.
 */
public record DependencyEdge(String source, String target, String type, String description) {
}
