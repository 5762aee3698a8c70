package com.helix.guardrails.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScopeCheckResult {

    /**
     * 0.0 (unrelated to the design) to 1.0 (fully aligned).
     */
    @Builder.Default
    private double alignmentScore = 1.0;

    private List<ScopeViolation> violations;

    private String summary;

    private boolean requiresTpmApproval;

    /** Model calls made, including repair attempts. */
    private int attempts;

    /** False when the model never produced parseable output. */
    private boolean parsed;

    public List<ScopeViolation> getViolations() {
        if (violations == null) {
            violations = new ArrayList<>();
        }
        return violations;
    }
}
