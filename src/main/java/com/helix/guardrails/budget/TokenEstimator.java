package com.helix.guardrails.budget;

/**
 * Tokenizer-free token counting.
 *
 * <p>English text runs at roughly 4 characters per token on common sub-word
 * tokenizers; 3.5 is used so counts err on the high side.
 */
public final class TokenEstimator {

    public static final double CHARS_PER_TOKEN = 3.5;

    public static final String TRUNCATION_MARKER = "\n...(truncated)";

    private TokenEstimator() {
    }

    /**
     * @return 0 for null or empty text, otherwise at least 1
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (int) (text.length() / CHARS_PER_TOKEN));
    }

    /**
     * Cuts {@code text} so that its estimate fits in {@code maxTokens}.
     *
     * <p>Text already within budget is returned as-is. Otherwise the cut backs up to
     * the last newline when that newline lies in the second half of the cut region,
     * and {@link #TRUNCATION_MARKER} is appended. The marker is paid for out of the
     * same budget, so the result never estimates above {@code maxTokens}.
     */
    public static String truncateToTokens(String text, int maxTokens) {
        if (estimateTokens(text) <= maxTokens) {
            return text;
        }
        if (maxTokens <= 0) {
            return "";
        }

        int budgetChars = (int) (maxTokens * CHARS_PER_TOKEN);
        int cutChars = budgetChars - TRUNCATION_MARKER.length();
        if (cutChars <= 0) {
            // too small to carry the marker
            return text.substring(0, budgetChars);
        }

        String truncated = text.substring(0, cutChars);
        int lastNewline = truncated.lastIndexOf('\n');
        if (lastNewline > cutChars / 2) {
            truncated = truncated.substring(0, lastNewline);
        }
        return truncated + TRUNCATION_MARKER;
    }
}
