package com.helix.guardrails.util;

import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.ServiceType;
import org.slf4j.Logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Entry point for call logging around the model endpoint, the stores and git,
 * plus helpers that keep payloads on one short line.
 */
public final class ExternalCallLogger {

    private static final int MAX_MAP_ENTRIES = 8;

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Collapses all whitespace runs to single spaces, then truncates. Used for
     * multi-line Cypher and prompts.
     */
    public static String singleLine(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        return truncate(text.strip().replaceAll("\\s+", " "), maxLength);
    }

    /**
     * Key-sorted {@code k=v} rendering; large maps are reduced to their size.
     */
    public static String compact(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() > MAX_MAP_ENTRIES) {
            return "{" + map.size() + " entries}";
        }
        return new TreeMap<>(map).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
