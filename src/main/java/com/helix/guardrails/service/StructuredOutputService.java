package com.helix.guardrails.service;

import com.helix.guardrails.budget.ModelProfile;
import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.budget.TokenEstimator;
import com.helix.guardrails.client.ChatMessage;
import com.helix.guardrails.client.CompletionRequest;
import com.helix.guardrails.client.CompletionResponse;
import com.helix.guardrails.client.LLMProvider;
import com.helix.guardrails.parser.JsonResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calls the model and turns its answer into a JSON object, re-prompting with an
 * explicit repair instruction when the answer does not parse.
 *
 * <p>The number of repair attempts comes from the active profile's {@code jsonRetries}.
 * Retries are immediate and sequential. Transport failures are not retried here; they
 * propagate as {@link com.helix.guardrails.exception.TransientIoException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StructuredOutputService {

    static final int REPAIR_EXCERPT_CHARS = 1500;

    private final LLMProvider llmProvider;
    private final JsonResponseParser parser;
    private final ModelProfileResolver profileResolver;

    /**
     * Plain completion with the profile's defaults; returns the raw content.
     */
    public String call(String agentName, String systemContent, String userContent, Integer maxTokens) {
        ModelProfile profile = profileResolver.activeProfile();
        List<ChatMessage> messages = new ArrayList<>();
        if (systemContent != null && !systemContent.isEmpty()) {
            messages.add(ChatMessage.system(systemContent));
        }
        messages.add(ChatMessage.user(userContent));

        CompletionRequest request = CompletionRequest.builder()
                .messages(messages)
                .temperature(0.0)
                .maxOutputTokens(maxTokens != null ? maxTokens : profile.maxOutputTokens())
                .constrainedJson(profile.requestsConstrainedJson())
                .build();

        CompletionResponse response = llmProvider.complete(request);
        log.info("Agent {} LLM call: model={}, tokens_in≈{}, usage={}",
                agentName,
                response.modelId(),
                TokenEstimator.estimateTokens(userContent + (systemContent == null ? "" : systemContent)),
                response.usage());
        return response.content();
    }

    public StructuredCallResult callStructured(String agentName, String prompt) {
        return callStructured(agentName, null, prompt, null);
    }

    /**
     * Call the model and parse a JSON object from its answer.
     *
     * <p>Never throws for malformed output: when every attempt fails the result is
     * {@link RepairState#EXHAUSTED} and carries the error-tagged map.
     */
    public StructuredCallResult callStructured(String agentName, String systemContent, String prompt, Integer maxTokens) {
        int retries = profileResolver.activeProfile().jsonRetries();

        RepairState state = RepairState.PARSING;
        int repairAttempt = 0;
        int attempts = 0;
        Map<String, Object> data = null;

        while (!state.isTerminal()) {
            String userContent = state == RepairState.PARSING ? prompt : repairPrompt(prompt);
            String raw = call(agentName, systemContent, userContent, maxTokens);
            attempts++;

            Optional<Map<String, Object>> parsed = parser.tryParse(raw);
            if (parsed.isPresent()) {
                data = parsed.get();
                state = RepairState.SUCCEEDED;
            } else if (repairAttempt < retries) {
                repairAttempt++;
                log.warn("Agent {}: JSON parse failed (attempt {}/{}), retrying with repair prompt",
                        agentName, repairAttempt, retries);
                state = RepairState.REPAIRING;
            } else {
                data = JsonResponseParser.errorResult(raw);
                state = RepairState.EXHAUSTED;
            }
        }

        if (state == RepairState.SUCCEEDED) {
            log.info("Agent {}: structured output parsed after {} attempt(s)", agentName, attempts);
        } else {
            log.warn("Agent {}: structured output from {} unparseable after {} attempt(s)",
                    agentName, llmProvider.describeBackend(), attempts);
        }
        return new StructuredCallResult(data, attempts, state);
    }

    static String repairPrompt(String originalPrompt) {
        String excerpt = originalPrompt.length() > REPAIR_EXCERPT_CHARS
                ? originalPrompt.substring(0, REPAIR_EXCERPT_CHARS)
                : originalPrompt;
        return "Your previous response was not valid JSON. "
                + "Please respond ONLY with a valid JSON object. "
                + "No markdown, no explanation, just the JSON.\n\n"
                + "Original request (summarised):\n" + excerpt;
    }
}
