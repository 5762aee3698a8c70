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
public class GapAnalysisResult {

    public static final String NO_TARGETS = "no_targets";

    /** on_track, at_risk, off_track, or {@value #NO_TARGETS}. */
    @Builder.Default
    private String overallStatus = "unknown";
    private List<MetricGap> gaps;
    private List<String> metricsOnTrack;
    private String executiveSummary;
    private String nextReviewDate;
    private String message;
    private int attempts;
    private boolean parsed;

    public List<MetricGap> getGaps() {
        if (gaps == null) {
            gaps = new ArrayList<>();
        }
        return gaps;
    }

    public List<String> getMetricsOnTrack() {
        if (metricsOnTrack == null) {
            metricsOnTrack = new ArrayList<>();
        }
        return metricsOnTrack;
    }
}
