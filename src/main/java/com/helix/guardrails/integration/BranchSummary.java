package com.helix.guardrails.integration;

/**
 * Pull-request-like view of a branch comparison.
 *
 * @param title       subject of the newest commit, or "(no commits)"
 * @param body        all commit subjects, one per line
 * @param commitCount number of commits in base..head
 */
public record BranchSummary(String title, String body, int commitCount) {
}
