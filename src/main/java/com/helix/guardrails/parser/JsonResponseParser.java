package com.helix.guardrails.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient JSON-object extraction from model output.
 *
 * <p>Two strategies, in order: strip Markdown code fences and parse the rest; then
 * parse the first brace-balanced {@code {...}} block. Only a JSON object counts as a
 * successful parse.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonResponseParser {

    public static final String ERROR_KEY = "error";
    public static final String RAW_KEY = "raw";
    static final String PARSE_ERROR = "Failed to parse response";
    static final int RAW_LIMIT = 500;

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * Parse model output into a map. Never throws: unparseable text yields
     * {@code {"error": "Failed to parse response", "raw": <first 500 chars>}}.
     */
    public Map<String, Object> parse(String text) {
        return tryParse(text).orElseGet(() -> errorResult(text));
    }

    /**
     * Parse model output, or empty when neither strategy yields a JSON object.
     */
    public Optional<Map<String, Object>> tryParse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String cleaned = stripTrailingBackticks(FENCE.matcher(text).replaceAll("").strip());
        Optional<Map<String, Object>> direct = readObject(cleaned);
        if (direct.isPresent()) {
            return direct;
        }

        String block = firstBraceBlock(text);
        if (block != null) {
            Optional<Map<String, Object>> embedded = readObject(block);
            if (embedded.isPresent()) {
                return embedded;
            }
        }

        log.warn("Failed to parse JSON from LLM response: {}...", text.substring(0, Math.min(200, text.length())));
        return Optional.empty();
    }

    public static boolean isError(Map<String, Object> result) {
        return result == null || result.containsKey(ERROR_KEY);
    }

    public static Map<String, Object> errorResult(String text) {
        String raw = text == null ? "" : text.substring(0, Math.min(RAW_LIMIT, text.length()));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ERROR_KEY, PARSE_ERROR);
        result.put(RAW_KEY, raw);
        return result;
    }

    private Optional<Map<String, Object>> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Substring from the first '{' to its matching '}' by brace depth, or to the end of
     * the text when the braces never balance; null when there is no '{'.
     */
    static String firstBraceBlock(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return text.substring(start);
    }

    private static String stripTrailingBackticks(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '`') {
            end--;
        }
        return text.substring(0, end);
    }
}
