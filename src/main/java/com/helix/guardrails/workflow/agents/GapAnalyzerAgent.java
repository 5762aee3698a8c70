package com.helix.guardrails.workflow.agents;

import com.helix.guardrails.budget.TokenBudget;
import com.helix.guardrails.service.StructuredCallResult;
import com.helix.guardrails.workflow.state.GapAnalysisRequest;
import com.helix.guardrails.workflow.state.GapAnalysisResult;
import com.helix.guardrails.workflow.state.MetricTarget;
import com.helix.guardrails.workflow.state.ProjectDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares post-launch metrics with the targets a PRD promised and explains the gaps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GapAnalyzerAgent {

    static final String AGENT_NAME = "gap_analyzer";
    static final String TEMPLATE = "gap-analysis";

    static final int TEMPLATE_CHROME_TOKENS = 400;
    static final int TARGETS_CAP = 500;
    static final int MIN_PER_DOC_TOKENS = 200;

    private final GuardrailAgentSupport support;

    public GapAnalysisResult analyze(GapAnalysisRequest request) {
        if (request.getMetricTargets().isEmpty()) {
            return GapAnalysisResult.builder()
                    .overallStatus(GapAnalysisResult.NO_TARGETS)
                    .message("No metric targets defined for this project.")
                    .build();
        }

        List<Map<String, Object>> targets = new ArrayList<>();
        for (MetricTarget t : request.getMetricTargets()) {
            Map<String, Object> target = new LinkedHashMap<>();
            target.put("metricName", t.metricName());
            target.put("targetValue", t.targetValue());
            target.put("actualValue", t.actualValue() != null && !t.actualValue().isBlank() ? t.actualValue() : "Unknown");
            target.put("gap", t.gap());
            targets.add(target);
        }

        TokenBudget budget = support.createBudget();
        budget.reserve("template_chrome", TEMPLATE_CHROME_TOKENS);
        budget.reserve("targets", Math.min(support.serializedLength(targets), TARGETS_CAP));

        List<ProjectDocument> documents = request.getDocuments();
        int perDocTokens = Math.max(MIN_PER_DOC_TOKENS, budget.remaining() / Math.max(documents.size(), 1));

        List<Map<String, Object>> docs = new ArrayList<>();
        for (ProjectDocument d : documents) {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("docType", d.docType());
            doc.put("title", d.title());
            doc.put("content", budget.fit("doc_" + d.id(), d.content(), perDocTokens));
            docs.add(doc);
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("projectName", request.getProjectName());
        variables.put("metricTargets", targets);
        variables.put("documents", docs);
        variables.put("daysSinceLaunch", request.getDaysSinceLaunch());
        budget.logSummary(AGENT_NAME);

        StructuredCallResult call = support.renderAndCall(AGENT_NAME, TEMPLATE, variables);
        GapAnalysisResult result = call.succeeded()
                ? support.convert(call.data(), GapAnalysisResult.class, new GapAnalysisResult())
                : GapAnalysisResult.builder().executiveSummary("Gap analysis output could not be parsed").build();
        result.setAttempts(call.attempts());
        result.setParsed(call.succeeded());

        log.info("✅ Gap analysis complete for project {}: status={}, gaps={}",
                request.getProjectId(), result.getOverallStatus(), result.getGaps().size());
        return result;
    }
}
