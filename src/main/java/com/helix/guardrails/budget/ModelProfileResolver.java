package com.helix.guardrails.budget;

import com.helix.guardrails.client.LlmProviderType;
import com.helix.guardrails.configuration.AppProperties;
import com.helix.guardrails.configuration.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks the {@link ModelProfile} for the configured model.
 *
 * <p>An explicit profile name wins; an unknown name falls back to
 * {@link ModelProfile#DEFAULT}. Without one, the profile is inferred from the
 * model identifiers. Resolution happens once, at construction.
 */
@Slf4j
@Component
public class ModelProfileResolver {

    private final ModelProfile activeProfile;
    private final String embeddingModel;

    public ModelProfileResolver(AppProperties props) {
        LlmProperties llm = props.getLlm();
        this.activeProfile = resolve(llm);
        this.embeddingModel = activeProfile.embeddingModel().isEmpty()
                ? llm.getEmbeddingModel()
                : activeProfile.embeddingModel();
        log.info("Model profile: {} (model={}, provider={}, embedding={})",
                activeProfile.name(), llm.getModel(), llm.getProvider(), embeddingModel);
    }

    static ModelProfile resolve(LlmProperties llm) {
        String explicit = llm.getProfile();
        if (explicit != null && !explicit.isBlank()) {
            ModelProfile profile = ModelProfile.BUILT_IN.get(explicit.trim());
            if (profile == null) {
                log.warn("Unknown model profile '{}', using default", explicit);
                return ModelProfile.DEFAULT;
            }
            return profile;
        }

        List<String> candidates = new ArrayList<>();
        candidates.add(llm.getModel().toLowerCase(Locale.ROOT));
        if (llm.getProvider() == LlmProviderType.MLX && llm.getMlxModel() != null) {
            candidates.add(llm.getMlxModel().toLowerCase(Locale.ROOT));
        }
        for (String model : candidates) {
            if (model.contains("qwen") && model.contains("7b")) {
                return ModelProfile.QWEN_7B;
            }
            if (model.contains("llama") && model.contains("8b")) {
                return ModelProfile.LLAMA_3_8B;
            }
        }
        return ModelProfile.DEFAULT;
    }

    public ModelProfile activeProfile() {
        return activeProfile;
    }

    /**
     * Whether the active model is treated as a small language model.
     */
    public boolean isSlm() {
        return activeProfile.simplifyPrompts();
    }

    /**
     * Embedding model name, preferring the profile's override.
     */
    public String resolvedEmbeddingModel() {
        return embeddingModel;
    }
}
