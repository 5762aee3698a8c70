package com.helix.guardrails.integration;

public record ProcessResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
