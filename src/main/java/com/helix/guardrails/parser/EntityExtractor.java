package com.helix.guardrails.parser;

import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.knowledge.GraphStore;
import com.helix.guardrails.model.EntityType;
import com.helix.guardrails.model.ExtractedEntity;
import com.helix.guardrails.service.StructuredOutputService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds named entities (teams, APIs, technologies, services, compliance items,
 * concepts) in document text and records them in the knowledge graph.
 *
 * <p>The model is asked first. If the call fails or its answer is not the expected
 * {@code {"entities": [...]}} object, a capitalised-phrase heuristic takes over, so
 * extraction always produces a result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityExtractor {

    static final int SLM_EXCERPT_CHARS = 2000;
    static final int DEFAULT_EXCERPT_CHARS = 4000;
    static final int MAX_OUTPUT_TOKENS = 1024;
    static final int FALLBACK_CAP = 20;

    static final String SYSTEM_PROMPT = "Extract named entities from the text. "
            + "Focus on: team names, API names, technologies, services, "
            + "compliance requirements, key concepts. "
            + "Return JSON: {\"entities\": [{\"name\": \"...\", "
            + "\"type\": \"team|api|technology|service|compliance|concept\"}]}";

    private static final Pattern CAPITALISED_PHRASE = Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+)\\b");
    private static final List<String> LEADING_STOP_WORDS = List.of(
            "The ", "This ", "That ", "These ", "Those ", "When ",
            "Where ", "With ", "From ", "About ", "After ", "Before ");

    private final StructuredOutputService structuredOutput;
    private final JsonResponseParser parser;
    private final ModelProfileResolver profileResolver;
    private final GraphStore graphStore;

    /**
     * Extract entities and link each one to the document in the graph. Graph writes are
     * best-effort: a failed upsert is logged and skipped.
     */
    public List<ExtractedEntity> extractAndStore(String content, String docId) {
        List<ExtractedEntity> entities = extract(content, docId);
        for (ExtractedEntity entity : entities) {
            try {
                graphStore.addEntity(entity.name(), entity.type().tag(), docId);
            } catch (RuntimeException e) {
                log.warn("Failed to store entity '{}' for doc {}: {}", entity.name(), docId, e.getMessage());
            }
        }
        return entities;
    }

    public List<ExtractedEntity> extract(String content, String docId) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        int limit = profileResolver.isSlm() ? SLM_EXCERPT_CHARS : DEFAULT_EXCERPT_CHARS;
        String excerpt = content.length() > limit ? content.substring(0, limit) : content;

        try {
            String raw = structuredOutput.call("entity_extractor", SYSTEM_PROMPT, excerpt, MAX_OUTPUT_TOKENS);
            Optional<List<ExtractedEntity>> fromModel = parser.tryParse(raw).flatMap(EntityExtractor::readEntities);
            if (fromModel.isPresent()) {
                return fromModel.get();
            }
            log.warn("Entity extraction returned no usable entities for doc {}, using regex fallback", docId);
        } catch (RuntimeException e) {
            log.warn("Entity extraction failed for doc {}, using regex fallback: {}", docId, e.getMessage());
        }
        return regexFallback(content);
    }

    private static Optional<List<ExtractedEntity>> readEntities(Map<String, Object> data) {
        if (!(data.get("entities") instanceof List<?> items)) {
            return Optional.empty();
        }
        Map<String, ExtractedEntity> unique = new LinkedHashMap<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> map && map.get("name") instanceof String name && !name.isBlank()) {
                Object type = map.get("type");
                ExtractedEntity entity = new ExtractedEntity(name, EntityType.fromTag(type == null ? null : type.toString()));
                unique.putIfAbsent(entity.normalizedName(), entity);
            }
        }
        return Optional.of(new ArrayList<>(unique.values()));
    }

    /**
     * Capitalised multi-word phrases, minus one leading stop word, de-duplicated in order
     * of first appearance and capped at 20. All are typed {@link EntityType#CONCEPT}.
     */
    static List<ExtractedEntity> regexFallback(String content) {
        Map<String, ExtractedEntity> unique = new LinkedHashMap<>();
        Matcher matcher = CAPITALISED_PHRASE.matcher(content);
        while (matcher.find() && unique.size() < FALLBACK_CAP) {
            String name = stripStopWord(matcher.group(1));
            if (name.isBlank()) {
                continue;
            }
            ExtractedEntity entity = new ExtractedEntity(name, EntityType.CONCEPT);
            unique.putIfAbsent(entity.normalizedName(), entity);
        }
        return new ArrayList<>(unique.values());
    }

    private static String stripStopWord(String phrase) {
        for (String prefix : LEADING_STOP_WORDS) {
            if (phrase.startsWith(prefix)) {
                return phrase.substring(prefix.length());
            }
        }
        return phrase;
    }
}
