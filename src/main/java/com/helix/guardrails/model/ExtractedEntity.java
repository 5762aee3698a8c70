package com.helix.guardrails.model;

import java.util.Locale;

/**
 * Named concept found in a document. The name is the graph merge key.
 */
public record ExtractedEntity(String name, EntityType type) {

    public ExtractedEntity {
        name = name == null ? "" : name.trim();
        type = type == null ? EntityType.CONCEPT : type;
    }

    /**
     * Key used for de-duplication within one extraction.
     */
    public String normalizedName() {
        return name.toLowerCase(Locale.ROOT);
    }
}
