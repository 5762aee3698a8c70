package com.helix.guardrails.budget;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Token Budget Tests")
class TokenBudgetTest {

    @Test
    @DisplayName("Profile budget is context minus output tokens")
    void forProfile_ShouldSubtractOutputTokens() {
        assertThat(TokenBudget.forProfile(ModelProfile.QWEN_7B).getTotalInputTokens()).isEqualTo(4096);
        assertThat(TokenBudget.forProfile(ModelProfile.DEFAULT).getTotalInputTokens()).isEqualTo(123904);
        assertThat(TokenBudget.forProfile(ModelProfile.QWEN_7B, 1024).getTotalInputTokens()).isEqualTo(5120);
    }

    @Test
    @DisplayName("Profile budget never drops below 512 input tokens")
    void forProfile_HugeOutput_ShouldFloorAt512() {
        assertThat(TokenBudget.forProfile(ModelProfile.QWEN_7B, 6100).getTotalInputTokens()).isEqualTo(512);
    }

    @Test
    @DisplayName("Reserve overwrites a section instead of adding to it")
    void reserve_SameSectionTwice_ShouldOverwrite() {
        TokenBudget budget = new TokenBudget(1000);

        budget.reserve("chrome", 300);
        budget.reserve("chrome", 100);

        assertThat(budget.used()).isEqualTo(100);
        assertThat(budget.remaining()).isEqualTo(900);
        assertThat(budget.allocated("chrome")).isEqualTo(100);
    }

    @Test
    @DisplayName("Remaining never goes negative")
    void remaining_OverReserved_ShouldBeZero() {
        TokenBudget budget = new TokenBudget(100);

        budget.reserve("a", 80);
        budget.reserve("b", 80);

        assertThat(budget.remaining()).isZero();
    }

    @Test
    @DisplayName("Fit records the fitted text's estimate, not the cap")
    void fit_ShortText_ShouldRecordActualEstimate() {
        TokenBudget budget = new TokenBudget(1000);

        String fitted = budget.fit("title", "x".repeat(35), 500);

        assertThat(fitted).hasSize(35);
        assertThat(budget.allocated("title")).isEqualTo(10);
        assertThat(budget.remaining()).isEqualTo(990);
    }

    @Test
    @DisplayName("Fit caps by the smaller of maxTokens and remaining")
    void fit_ShouldRespectCapAndRemaining() {
        // Given
        TokenBudget budget = new TokenBudget(1000);
        budget.reserve("chrome", 900);

        // When: cap 500 but only 100 left
        String fitted = budget.fit("doc", "y".repeat(5000), 500);

        // Then
        assertThat(TokenEstimator.estimateTokens(fitted)).isLessThanOrEqualTo(100);
        assertThat(budget.remaining()).isGreaterThanOrEqualTo(0);
        assertThat(budget.used()).isLessThanOrEqualTo(1000);
    }

    @Test
    @DisplayName("Null cap means only remaining limits the fit")
    void fit_NullCap_ShouldUseRemaining() {
        TokenBudget budget = new TokenBudget(600);
        budget.reserve("chrome", 100);

        String fitted = budget.fit("doc", "z".repeat(10_000));

        assertThat(TokenEstimator.estimateTokens(fitted)).isLessThanOrEqualTo(500);
        assertThat(TokenEstimator.estimateTokens(fitted)).isGreaterThan(450);
    }

    @Test
    @DisplayName("Null text fits as empty")
    void fit_NullText_ShouldBeEmpty() {
        TokenBudget budget = new TokenBudget(600);

        assertThat(budget.fit("doc", null)).isEmpty();
        assertThat(budget.allocated("doc")).isZero();
    }

    @Test
    @DisplayName("Sections fitted in order share the remainder without overflowing")
    void fit_PrioritisedSections_ShouldStayWithinTotal() {
        // Given
        TokenBudget budget = new TokenBudget(4096);
        budget.reserve("template_chrome", 500);
        budget.reserve("pr_meta", 200);
        int remaining = budget.remaining();

        // When
        budget.fit("design_doc", "d".repeat(50_000), (int) (remaining * 0.4));
        budget.fit("repo_map", "r".repeat(50_000), (int) (remaining * 0.1));
        budget.fit("diff", "f".repeat(50_000), (int) (remaining * 0.5));

        // Then
        assertThat(budget.used()).isLessThanOrEqualTo(4096);
        assertThat(budget.allocations()).containsOnlyKeys("template_chrome", "pr_meta", "design_doc", "repo_map", "diff");
        assertThat(budget.allocated("design_doc")).isLessThanOrEqualTo((int) (remaining * 0.4));
    }

    @Test
    @DisplayName("Unknown section reports zero allocation")
    void allocated_UnknownSection_ShouldBeZero() {
        assertThat(new TokenBudget(100).allocated("missing")).isZero();
    }
}
