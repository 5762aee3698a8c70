package com.helix.guardrails.budget;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Splits one request's input-token pool across named prompt sections.
 *
 * <p>Both {@link #reserve} and {@link #fit} overwrite a section's previous
 * allocation rather than adding to it. Because {@link #fit} draws on whatever
 * {@link #remaining()} is at call time, sections must be processed in a fixed
 * priority order: template overhead, then fixed-size metadata, then shares of the
 * remainder for the large free-text sections.
 *
 * <p>Owned by a single request; not thread-safe.
 */
@Slf4j
public class TokenBudget {

    static final int MIN_INPUT_TOKENS = 512;

    private final int totalInputTokens;
    private final Map<String, Integer> allocated = new LinkedHashMap<>();

    public TokenBudget(int totalInputTokens) {
        this.totalInputTokens = totalInputTokens;
    }

    public static TokenBudget forProfile(ModelProfile profile) {
        return forProfile(profile, null);
    }

    /**
     * @param outputTokens tokens kept for the answer; {@code null} uses the profile's max output
     */
    public static TokenBudget forProfile(ModelProfile profile, Integer outputTokens) {
        int out = outputTokens != null ? outputTokens : profile.maxOutputTokens();
        return new TokenBudget(Math.max(MIN_INPUT_TOKENS, profile.effectiveContextTokens() - out));
    }

    public void reserve(String section, int tokens) {
        allocated.put(section, tokens);
    }

    public int remaining() {
        return Math.max(0, totalInputTokens - used());
    }

    public String fit(String section, String text) {
        return fit(section, text, null);
    }

    /**
     * Truncates {@code text} to the tokens still available, optionally capped by
     * {@code maxTokens}, and records the fitted text's actual estimate for the section.
     */
    public String fit(String section, String text, Integer maxTokens) {
        int available = maxTokens != null ? Math.min(maxTokens, remaining()) : remaining();
        String fitted = TokenEstimator.truncateToTokens(text == null ? "" : text, available);
        allocated.put(section, TokenEstimator.estimateTokens(fitted));
        return fitted;
    }

    public int used() {
        return allocated.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalInputTokens() {
        return totalInputTokens;
    }

    /**
     * @return tokens recorded for {@code section}, 0 when it has none
     */
    public int allocated(String section) {
        return allocated.getOrDefault(section, 0);
    }

    public Map<String, Integer> allocations() {
        return Collections.unmodifiableMap(allocated);
    }

    public void logSummary(String agentName) {
        log.info("Token budget [{}]: total={}, used={}, remaining={} | {}",
                agentName == null || agentName.isEmpty() ? "unknown" : agentName,
                totalInputTokens,
                used(),
                remaining(),
                allocated.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", ")));
    }
}
