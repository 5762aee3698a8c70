package com.helix.guardrails.model;

/**
 * External collaborators the core talks to. Tags call logs and
 * {@link com.helix.guardrails.exception.TransientIoException}s.
 */
public enum ServiceType {
    PINECONE("Pinecone", "vector"),
    NEO4J("Neo4j", "graph"),
    LLM("Model endpoint", "llm"),
    EMBEDDING("Embedding model", "embed"),
    GIT("git", "proc");

    private final String displayName;
    private final String tag;

    ServiceType(String displayName, String tag) {
        this.displayName = displayName;
        this.tag = tag;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Short lower-case marker printed in front of every call log line.
     */
    public String tag() {
        return tag;
    }
}
