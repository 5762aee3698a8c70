package com.helix.guardrails.workflow.agents;

import com.helix.guardrails.budget.TokenBudget;
import com.helix.guardrails.query.HybridRetriever;
import com.helix.guardrails.service.StructuredCallResult;
import com.helix.guardrails.workflow.state.ScopeCheckRequest;
import com.helix.guardrails.workflow.state.ScopeCheckResult;
import com.helix.guardrails.workflow.state.ScopeViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a pull request diff with the project's approved design and reports scope
 * creep and architecture violations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScopeCheckerAgent {

    static final String AGENT_NAME = "scope_checker";
    static final String TEMPLATE = "scope-check";
    static final String NO_DESIGN_DOC = "(No design document found for this project)";

    static final int TEMPLATE_CHROME_TOKENS = 500;
    static final int PR_META_TOKENS = 200;

    private final GuardrailAgentSupport support;
    private final HybridRetriever retriever;

    public ScopeCheckResult check(ScopeCheckRequest request) {
        log.info("🔍 Scope check for {}#{}", request.getRepoName(), request.getPrNumber());

        String designDoc = request.getDesignDoc() != null
                ? request.getDesignDoc()
                : retriever.retrieveDesignDoc(request.getProjectId()).orElse(NO_DESIGN_DOC);
        String repoMap = repoMap(request.getRepoName());

        TokenBudget budget = support.createBudget();
        budget.reserve("template_chrome", TEMPLATE_CHROME_TOKENS);
        budget.reserve("pr_meta", PR_META_TOKENS);

        // 40% design doc, 10% repo map, 50% diff of what is left
        int remaining = budget.remaining();
        String designFitted = budget.fit("design_doc", designDoc, (int) (remaining * 0.4));
        String repoMapFitted = budget.fit("repo_map", repoMap, (int) (remaining * 0.1));
        String diffFitted = budget.fit("diff", request.getDiff(), (int) (remaining * 0.5));

        Map<String, Object> variables = new HashMap<>();
        variables.put("designDoc", designFitted);
        variables.put("repoMap", repoMapFitted);
        variables.put("prNumber", request.getPrNumber());
        variables.put("repoName", request.getRepoName());
        variables.put("prTitle", nullToEmpty(request.getPrTitle()));
        variables.put("prDescription", nullToEmpty(request.getPrDescription()));
        variables.put("diff", diffFitted);
        budget.logSummary(AGENT_NAME);

        StructuredCallResult call = support.renderAndCall(AGENT_NAME, TEMPLATE, variables);
        ScopeCheckResult result = call.succeeded()
                ? support.convert(call.data(), ScopeCheckResult.class, new ScopeCheckResult())
                : ScopeCheckResult.builder().summary("Scope check output could not be parsed").build();
        result.setAttempts(call.attempts());
        result.setParsed(call.succeeded());

        log.info("✅ Scope check complete for {}#{}: score={}, violations={}",
                request.getRepoName(), request.getPrNumber(), result.getAlignmentScore(), result.getViolations().size());
        return result;
    }

    private String repoMap(String repoName) {
        try {
            return retriever.retrieveRepoContext(repoName).orElse("");
        } catch (RuntimeException e) {
            log.warn("Repo map lookup failed for {}: {}", repoName, e.getMessage());
            return "";
        }
    }

    /**
     * Markdown report suitable for a pull request comment.
     */
    public static String formatReport(ScopeCheckResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("## Helix Scope Check Report");
        lines.add("");
        lines.add("**Alignment Score:** " + result.getAlignmentScore());
        lines.add("");

        if (!result.getViolations().isEmpty()) {
            lines.add("### Violations Found");
            lines.add("");
            for (ScopeViolation v : result.getViolations()) {
                lines.add("- " + severityIcon(v.getSeverity()) + " **"
                        + (v.getViolationType() != null ? v.getViolationType() : "Unknown") + "** in `"
                        + (v.getFile() != null ? v.getFile() : "N/A") + "`: "
                        + nullToEmpty(v.getDescription()));
                if (v.getRecommendation() != null && !v.getRecommendation().isEmpty()) {
                    lines.add("  - **Recommendation:** " + v.getRecommendation());
                }
            }
            lines.add("");
        }

        if (result.isRequiresTpmApproval()) {
            lines.add("⚠️ **TPM approval is required before merging this PR.**");
            lines.add("");
        }

        lines.add("**Summary:** " + (result.getSummary() != null ? result.getSummary() : "No summary available."));
        lines.add("");
        lines.add("---");
        lines.add("*Generated by Helix TPM Guardrails*");
        return String.join("\n", lines);
    }

    private static String severityIcon(String severity) {
        if (severity == null) {
            return "⚪";
        }
        return switch (severity) {
            case "critical" -> "🔴";
            case "warning" -> "🟡";
            case "info" -> "🔵";
            default -> "⚪";
        };
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
