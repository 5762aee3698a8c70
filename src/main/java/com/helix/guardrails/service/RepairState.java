package com.helix.guardrails.service;

/**
 * States of the structured-output repair loop.
 *
 * <pre>
 * PARSING ──valid──▶ SUCCEEDED
 *    │ invalid, retries left
 *    ▼
 * REPAIRING(k) ──valid──▶ SUCCEEDED
 *    │ invalid, k &lt; retries ──▶ REPAIRING(k+1)
 *    │ invalid, k = retries
 *    ▼
 * EXHAUSTED
 * </pre>
 * PARSING goes straight to EXHAUSTED when the profile allows no retries.
 */
public enum RepairState {
    PARSING,
    REPAIRING,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
