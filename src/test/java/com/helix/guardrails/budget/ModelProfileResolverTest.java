package com.helix.guardrails.budget;

import com.helix.guardrails.client.LlmProviderType;
import com.helix.guardrails.configuration.AppProperties;
import com.helix.guardrails.configuration.LlmProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Model Profile Resolver Tests")
class ModelProfileResolverTest {

    private static LlmProperties llm(LlmProviderType provider, String model, String profile) {
        LlmProperties props = new LlmProperties();
        props.setProvider(provider);
        props.setModel(model);
        props.setProfile(profile);
        return props;
    }

    @Test
    @DisplayName("Explicit profile name wins over model detection")
    void resolve_ExplicitProfile_ShouldWin() {
        LlmProperties props = llm(LlmProviderType.OPENAI, "gpt-4o", "llama-3-8b");

        assertThat(ModelProfileResolver.resolve(props)).isEqualTo(ModelProfile.LLAMA_3_8B);
    }

    @Test
    @DisplayName("Unknown explicit profile falls back to default")
    void resolve_UnknownProfile_ShouldUseDefault() {
        LlmProperties props = llm(LlmProviderType.OLLAMA, "qwen2.5:7b", "tiny-model");

        assertThat(ModelProfileResolver.resolve(props)).isEqualTo(ModelProfile.DEFAULT);
    }

    @Test
    @DisplayName("Qwen 7B model names are detected case-insensitively")
    void resolve_QwenModel_ShouldDetectQwenProfile() {
        assertThat(ModelProfileResolver.resolve(llm(LlmProviderType.OLLAMA, "Qwen2.5:7B-instruct", "")))
                .isEqualTo(ModelProfile.QWEN_7B);
    }

    @Test
    @DisplayName("Llama 8B model names are detected")
    void resolve_LlamaModel_ShouldDetectLlamaProfile() {
        assertThat(ModelProfileResolver.resolve(llm(LlmProviderType.OLLAMA, "llama3.1:8b", "")))
                .isEqualTo(ModelProfile.LLAMA_3_8B);
    }

    @Test
    @DisplayName("MLX provider also consults the MLX model id")
    void resolve_MlxProvider_ShouldUseMlxModel() {
        LlmProperties props = llm(LlmProviderType.MLX, "local", "");
        props.setMlxModel("mlx-community/Qwen2.5-7B-Instruct-4bit");

        assertThat(ModelProfileResolver.resolve(props)).isEqualTo(ModelProfile.QWEN_7B);
    }

    @Test
    @DisplayName("Hosted models resolve to the default profile")
    void resolve_HostedModel_ShouldUseDefault() {
        assertThat(ModelProfileResolver.resolve(llm(LlmProviderType.OPENAI, "gpt-4o", null)))
                .isEqualTo(ModelProfile.DEFAULT);
    }

    @Test
    @DisplayName("Profile embedding model overrides the configured one")
    void resolvedEmbeddingModel_SlmProfile_ShouldUseProfileModel() {
        // Given
        AppProperties app = new AppProperties();
        app.setLlm(llm(LlmProviderType.OLLAMA, "qwen2.5:7b", ""));
        app.getLlm().setEmbeddingModel("nomic-embed-text");

        // When
        ModelProfileResolver resolver = new ModelProfileResolver(app);

        // Then
        assertThat(resolver.isSlm()).isTrue();
        assertThat(resolver.resolvedEmbeddingModel()).isEqualTo("all-MiniLM-L6-v2");
    }

    @Test
    @DisplayName("Default profile keeps the configured embedding model")
    void resolvedEmbeddingModel_DefaultProfile_ShouldUseConfiguredModel() {
        AppProperties app = new AppProperties();
        app.getLlm().setEmbeddingModel("text-embedding-3-large");

        ModelProfileResolver resolver = new ModelProfileResolver(app);

        assertThat(resolver.isSlm()).isFalse();
        assertThat(resolver.activeProfile()).isEqualTo(ModelProfile.DEFAULT);
        assertThat(resolver.resolvedEmbeddingModel()).isEqualTo("text-embedding-3-large");
    }
}
