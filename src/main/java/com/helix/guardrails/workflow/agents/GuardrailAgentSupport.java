package com.helix.guardrails.workflow.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.budget.TokenBudget;
import com.helix.guardrails.model.RenderedPrompt;
import com.helix.guardrails.service.PromptLibraryService;
import com.helix.guardrails.service.StructuredCallResult;
import com.helix.guardrails.service.StructuredOutputService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Shared plumbing for the guardrail agents: budget sizing, prompt rendering,
 * structured calls and result mapping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardrailAgentSupport {

    private final ModelProfileResolver profileResolver;
    private final PromptLibraryService promptLibrary;
    private final StructuredOutputService structuredOutput;
    private final ObjectMapper objectMapper;

    public TokenBudget createBudget() {
        return TokenBudget.forProfile(profileResolver.activeProfile());
    }

    public boolean isSlm() {
        return profileResolver.isSlm();
    }

    public int retrievalTopK() {
        return profileResolver.activeProfile().retrievalTopK();
    }

    public StructuredCallResult renderAndCall(String agentName, String templateName, Map<String, Object> variables) {
        RenderedPrompt prompt = promptLibrary.render(templateName, variables);
        return structuredOutput.callStructured(agentName, prompt.system(), prompt.user(), null);
    }

    /**
     * Map a parsed model answer onto a result type; unknown fields are ignored and a
     * shape mismatch yields an empty result.
     */
    public <T> T convert(Map<String, Object> data, Class<T> type, T fallback) {
        try {
            return objectMapper.convertValue(data, type);
        } catch (IllegalArgumentException e) {
            log.warn("Model output does not match {}: {}", type.getSimpleName(), e.getMessage());
            return fallback;
        }
    }

    /**
     * Length of a value's JSON form, used to size budget reservations for
     * structured prompt inputs.
     */
    public int serializedLength(Object value) {
        try {
            return objectMapper.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            return String.valueOf(value).length();
        }
    }
}
