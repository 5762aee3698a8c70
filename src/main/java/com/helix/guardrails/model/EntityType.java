package com.helix.guardrails.model;

import java.util.Locale;

/**
 * Closed vocabulary for knowledge-graph entities.
 */
public enum EntityType {
    TEAM,
    API,
    TECHNOLOGY,
    SERVICE,
    COMPLIANCE,
    CONCEPT;

    /**
     * Maps a model-supplied type tag onto the vocabulary; anything unrecognised is a CONCEPT.
     */
    public static EntityType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return CONCEPT;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CONCEPT;
        }
    }

    /**
     * Lower-case form stored on graph nodes.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
