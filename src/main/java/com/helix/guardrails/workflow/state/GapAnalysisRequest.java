package com.helix.guardrails.workflow.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GapAnalysisRequest {
    String projectId;
    String projectName;
    @Singular
    List<MetricTarget> metricTargets;
    @Singular
    List<ProjectDocument> documents;
    long daysSinceLaunch;
}
