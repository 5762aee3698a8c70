package com.helix.guardrails.workflow.state;

public record ProjectDocument(String id, String docType, String title, String content) {
}
