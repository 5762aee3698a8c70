package com.helix.guardrails.workflow.state;

import java.util.Locale;

/**
 * Launch promise from a PRD and its currently observed value (null when unknown).
 */
public record MetricTarget(String metricName, String targetValue, String actualValue) {

    /**
     * Relative shortfall {@code (target - actual) / target} as a percentage with one
     * decimal, or null when either value is missing or non-numeric or the target is zero.
     */
    public String gap() {
        if (targetValue == null || actualValue == null || actualValue.isBlank()) {
            return null;
        }
        try {
            double target = Double.parseDouble(targetValue.trim());
            double actual = Double.parseDouble(actualValue.trim());
            if (target == 0) {
                return null;
            }
            return String.format(Locale.ROOT, "%.1f%%", (target - actual) / target * 100);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
