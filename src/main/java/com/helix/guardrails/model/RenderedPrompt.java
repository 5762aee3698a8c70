package com.helix.guardrails.model;

/**
 * A template rendered into the system and user messages of one call.
 */
public record RenderedPrompt(String system, String user) {
}
