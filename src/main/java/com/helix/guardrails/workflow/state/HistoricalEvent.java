package com.helix.guardrails.workflow.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Past delivery event used as risk evidence (e.g. a security review that took 14 days).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HistoricalEvent(String eventType, String team, Integer durationDays, String outcome, String description) {
}
