package com.helix.guardrails.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: scope-check
 * version: 1.0
 * systemPrompt: |
 *   You are ...
 * userPrompt: |
 *   ## Design document
 *   {{designDoc}}
 * simplifiedUserPrompt: |
 *   ...
 * </pre>
 *
 * The simplified variants are optional; small-model profiles use them when present.
 *
 * @see com.helix.guardrails.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
    private String simplifiedSystemPrompt;
    private String simplifiedUserPrompt;

    public String systemFor(boolean simplified) {
        return simplified && simplifiedSystemPrompt != null ? simplifiedSystemPrompt : systemPrompt;
    }

    public String userFor(boolean simplified) {
        return simplified && simplifiedUserPrompt != null ? simplifiedUserPrompt : userPrompt;
    }
}
