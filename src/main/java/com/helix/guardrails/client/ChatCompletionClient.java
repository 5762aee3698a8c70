package com.helix.guardrails.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helix.guardrails.configuration.AppProperties;
import com.helix.guardrails.configuration.LlmProperties;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Single chat-completion adapter for every configured backend.
 *
 * <p>The provider tag picks the wire dialect (OpenAI-compatible, Ollama or Gemini);
 * endpoint, model and credentials come from {@code app.llm.*}. Created once at
 * context start and shared.
 *
 * <p>One HTTP call per request: failures surface as {@link TransientIoException}
 * and the caller owns any retry policy.
 */
@Slf4j
@Component
public class ChatCompletionClient implements LLMProvider {

    private static final Map<String, Object> JSON_OBJECT_FORMAT = Map.of("type", "json_object");

    private final LlmProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    @Autowired
    public ChatCompletionClient(AppProperties appProperties, ObjectMapper objectMapper) {
        this(appProperties.getLlm(), objectMapper, buildWebClient(appProperties.getLlm()));
    }

    ChatCompletionClient(LlmProperties props, ObjectMapper objectMapper, WebClient webClient) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.webClient = webClient;
    }

    private static WebClient buildWebClient(LlmProperties props) {
        int timeout = props.getTimeoutSeconds();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(Duration.ofSeconds(timeout))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout, TimeUnit.SECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.resolvedBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));

        String apiKey = props.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            if (props.getProvider().getDialect() == LlmProviderType.WireDialect.GEMINI) {
                builder.defaultHeader("x-goog-api-key", apiKey);
            } else {
                builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            }
        }
        return builder.build();
    }

    @Override
    public String describeBackend() {
        return props.getProvider() + " (" + modelId() + ")";
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.LLM, "chat", log);
        ctx.logRequest(null,
                "Model", modelId(),
                "Messages", request.getMessages().size(),
                "MaxTokens", request.getMaxOutputTokens(),
                "ConstrainedJson", request.isConstrainedJson());

        try {
            JsonNode response = webClient.post()
                    .uri(requestPath())
                    .bodyValue(buildRequestBody(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            CompletionResponse result = parseResponse(response);
            ctx.logResponse(ExternalCallLogger.truncate(result.content(), 500),
                    "Length", result.content().length(),
                    "Usage", ExternalCallLogger.compact(result.usage()));
            return result;

        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            ctx.logError(cause.getMessage(), cause);
            throw new TransientIoException(ServiceType.LLM,
                    "Chat completion failed against " + props.resolvedBaseUrl() + ": " + cause.getMessage(), cause);
        }
    }

    String modelId() {
        return props.getProvider() == LlmProviderType.MLX ? props.getMlxModel() : props.getModel();
    }

    String requestPath() {
        return switch (props.getProvider().getDialect()) {
            case OPENAI_COMPATIBLE -> "/v1/chat/completions";
            case OLLAMA -> "/api/chat";
            case GEMINI -> "/v1beta/models/" + modelId() + ":generateContent";
        };
    }

    Map<String, Object> buildRequestBody(CompletionRequest request) {
        return switch (props.getProvider().getDialect()) {
            case OPENAI_COMPATIBLE -> openAiBody(request);
            case OLLAMA -> ollamaBody(request);
            case GEMINI -> geminiBody(request);
        };
    }

    private Map<String, Object> openAiBody(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId());
        body.put("messages", messageMaps(request.getMessages()));
        body.put("temperature", request.getTemperature());
        body.put("max_tokens", request.getMaxOutputTokens());
        if (request.isConstrainedJson()) {
            body.put("response_format", JSON_OBJECT_FORMAT);
        }
        return body;
    }

    private Map<String, Object> ollamaBody(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId());
        body.put("messages", messageMaps(request.getMessages()));
        body.put("stream", false);
        if (request.isConstrainedJson()) {
            body.put("format", "json");
        }
        body.put("options", Map.of(
                "temperature", request.getTemperature(),
                "num_predict", request.getMaxOutputTokens()));
        return body;
    }

    private Map<String, Object> geminiBody(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        List<Map<String, Object>> contents = new ArrayList<>();
        StringBuilder system = new StringBuilder();
        for (ChatMessage message : request.getMessages()) {
            if ("system".equals(message.role())) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.content());
                continue;
            }
            String role = "assistant".equals(message.role()) ? "model" : "user";
            contents.add(Map.of("role", role, "parts", List.of(Map.of("text", message.content()))));
        }
        if (system.length() > 0) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system.toString()))));
        }
        body.put("contents", contents);

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", request.getTemperature());
        generationConfig.put("maxOutputTokens", request.getMaxOutputTokens());
        if (request.isConstrainedJson()) {
            generationConfig.put("responseMimeType", "application/json");
        }
        body.put("generationConfig", generationConfig);
        return body;
    }

    private static List<Map<String, String>> messageMaps(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
    }

    CompletionResponse parseResponse(JsonNode response) {
        if (response == null) {
            return new CompletionResponse("", modelId(), Map.of());
        }
        return switch (props.getProvider().getDialect()) {
            case OPENAI_COMPATIBLE -> new CompletionResponse(
                    response.path("choices").path(0).path("message").path("content").asText(""),
                    response.path("model").asText(modelId()),
                    toMap(response.path("usage")));
            case OLLAMA -> {
                Map<String, Object> usage = new LinkedHashMap<>();
                if (response.has("prompt_eval_count")) {
                    usage.put("prompt_tokens", response.path("prompt_eval_count").asInt());
                }
                if (response.has("eval_count")) {
                    usage.put("completion_tokens", response.path("eval_count").asInt());
                }
                yield new CompletionResponse(
                        response.path("message").path("content").asText(""),
                        response.path("model").asText(modelId()),
                        usage);
            }
            case GEMINI -> {
                StringBuilder text = new StringBuilder();
                for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
                    text.append(part.path("text").asText(""));
                }
                yield new CompletionResponse(text.toString(), modelId(), toMap(response.path("usageMetadata")));
            }
        };
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }
}
