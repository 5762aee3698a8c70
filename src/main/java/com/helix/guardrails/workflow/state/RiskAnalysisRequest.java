package com.helix.guardrails.workflow.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskAnalysisRequest {
    String projectId;
    String documentId;
    String prdContent;
    /** Most recent first. */
    @Singular
    List<HistoricalEvent> historicalEvents;
}
