package com.helix.guardrails.service;

import java.util.Map;

/**
 * Outcome of a structured model call.
 *
 * @param data     parsed object; on {@link RepairState#EXHAUSTED} the error-tagged map
 *                 with the last raw response
 * @param attempts model calls made, including the first
 * @param state    {@link RepairState#SUCCEEDED} or {@link RepairState#EXHAUSTED}
 */
public record StructuredCallResult(Map<String, Object> data, int attempts, RepairState state) {

    public boolean succeeded() {
        return state == RepairState.SUCCEEDED;
    }

    public boolean isError() {
        return !succeeded();
    }
}
