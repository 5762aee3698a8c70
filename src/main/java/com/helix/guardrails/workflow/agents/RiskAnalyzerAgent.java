package com.helix.guardrails.workflow.agents;

import com.helix.guardrails.budget.TokenBudget;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.model.RetrievalResult;
import com.helix.guardrails.query.HybridRetriever;
import com.helix.guardrails.service.StructuredCallResult;
import com.helix.guardrails.workflow.state.DependencyFinding;
import com.helix.guardrails.workflow.state.HistoricalEvent;
import com.helix.guardrails.workflow.state.RiskAnalysisRequest;
import com.helix.guardrails.workflow.state.RiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans a PRD against historical delivery events and similar past documents, and
 * predicts launch blockers and cross-team dependencies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskAnalyzerAgent {

    static final String AGENT_NAME = "risk_analyzer";
    static final String TEMPLATE = "risk-analysis";

    static final int TEMPLATE_CHROME_TOKENS = 400;
    static final int HISTORICAL_CAP = 600;
    static final int SLM_EVENT_LIMIT = 10;
    static final int DEFAULT_EVENT_LIMIT = 20;
    static final int SIMILAR_QUERY_CHARS = 1000;
    static final int SIMILAR_SUMMARY_CHARS = 200;

    private final GuardrailAgentSupport support;
    private final HybridRetriever retriever;
    private final GraphStore graphStore;

    public RiskAssessment analyze(RiskAnalysisRequest request) {
        String prd = request.getPrdContent() == null ? "" : request.getPrdContent();
        log.info("⚠️ Risk analysis for doc {} (project {})", request.getDocumentId(), request.getProjectId());

        int eventLimit = support.isSlm() ? SLM_EVENT_LIMIT : DEFAULT_EVENT_LIMIT;
        List<HistoricalEvent> events = request.getHistoricalEvents().stream()
                .limit(eventLimit)
                .toList();

        List<Map<String, Object>> similarDocs = similarDocs(prd);

        TokenBudget budget = support.createBudget();
        budget.reserve("template_chrome", TEMPLATE_CHROME_TOKENS);
        budget.reserve("historical", Math.min(support.serializedLength(events), HISTORICAL_CAP));
        String prdFitted = budget.fit("prd_content", prd);

        Map<String, Object> variables = new HashMap<>();
        variables.put("prdContent", prdFitted);
        variables.put("historicalEvents", events);
        variables.put("similarDocs", similarDocs);
        budget.logSummary(AGENT_NAME);

        StructuredCallResult call = support.renderAndCall(AGENT_NAME, TEMPLATE, variables);
        RiskAssessment assessment = call.succeeded()
                ? support.convert(call.data(), RiskAssessment.class, new RiskAssessment())
                : RiskAssessment.builder().summary("Risk analysis output could not be parsed").build();
        assessment.setAttempts(call.attempts());
        assessment.setParsed(call.succeeded());

        storeDependencies(request.getProjectId(), assessment.getDependencies());

        log.info("✅ Risk analysis complete for doc {}: score={}, risks={}, deps={}",
                request.getDocumentId(), assessment.getOverallRiskScore(),
                assessment.getRisks().size(), assessment.getDependencies().size());
        return assessment;
    }

    private List<Map<String, Object>> similarDocs(String prd) {
        if (prd.isBlank()) {
            return List.of();
        }
        String query = prd.length() > SIMILAR_QUERY_CHARS ? prd.substring(0, SIMILAR_QUERY_CHARS) : prd;
        try {
            List<RetrievalResult> results = retriever.retrieveSimilar(query, Map.of(), support.retrievalTopK());
            return results.stream()
                    .map(r -> Map.<String, Object>of(
                            "title", String.valueOf(r.metadata().getOrDefault("title", "Unknown")),
                            "summary", r.content().length() > SIMILAR_SUMMARY_CHARS
                                    ? r.content().substring(0, SIMILAR_SUMMARY_CHARS)
                                    : r.content()))
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Similar-document lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    private void storeDependencies(String projectId, List<DependencyFinding> dependencies) {
        for (DependencyFinding dep : dependencies) {
            if (dep.getTarget() == null || dep.getTarget().isBlank()) {
                continue;
            }
            try {
                graphStore.addDependency(projectId, dep.getTarget(),
                        dep.getType() != null ? dep.getType() : "hard",
                        dep.getDescription() != null ? dep.getDescription() : "");
            } catch (RuntimeException e) {
                log.warn("Failed to store dependency {} -> {}: {}", projectId, dep.getTarget(), e.getMessage());
            }
        }
    }
}
