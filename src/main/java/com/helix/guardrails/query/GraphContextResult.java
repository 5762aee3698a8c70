package com.helix.guardrails.query;

import com.helix.guardrails.model.ProjectGraph;
import com.helix.guardrails.model.RetrievalResult;

import java.util.List;

/**
 * Vector hits for a query plus the structural context of the project they belong to.
 */
public record GraphContextResult(List<RetrievalResult> vectorResults, ProjectGraph graphContext) {
}
