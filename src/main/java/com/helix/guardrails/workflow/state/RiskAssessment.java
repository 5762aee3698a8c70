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
public class RiskAssessment {

    private double overallRiskScore;
    private List<RiskItem> risks;
    private List<DependencyFinding> dependencies;
    private String summary;
    private int attempts;
    private boolean parsed;

    public List<RiskItem> getRisks() {
        if (risks == null) {
            risks = new ArrayList<>();
        }
        return risks;
    }

    public List<DependencyFinding> getDependencies() {
        if (dependencies == null) {
            dependencies = new ArrayList<>();
        }
        return dependencies;
    }
}
