package com.helix.guardrails.model;

import lombok.Getter;
import org.slf4j.Logger;

import java.util.StringJoiner;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One in-flight external call. Request and response lines go to INFO with the
 * call id so both ends can be matched up; payload summaries and key/value details
 * go to DEBUG.
 *
 * @see com.helix.guardrails.util.ExternalCallLogger
 */
@Getter
public class CallContext {

    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Logger logger;
    private final long startNanos;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.logger = logger;
        this.startNanos = System.nanoTime();
    }

    /**
     * @param details alternating key/value pairs
     */
    public void logRequest(String summary, Object... details) {
        logger.info("[{}] {} → {} ({})", service.tag(), service.displayName(), operation, callId);
        logPayload("request", summary, details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("[{}] {} ← {} ({}) in {}ms",
                service.tag(), service.displayName(), operation, callId, getElapsedMs());
        logPayload("response", summary, details);
    }

    /**
     * Logged at WARN: the caller either rethrows as a typed exception or degrades.
     */
    public void logError(String message, Throwable cause) {
        logger.warn("[{}] {} ✖ {} ({}) after {}ms: {}",
                service.tag(), service.displayName(), operation, callId, getElapsedMs(), message);
        if (cause != null) {
            logger.debug("[{}] {} ({}) failure", service.tag(), operation, callId, cause);
        }
    }

    public long getElapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void logPayload(String direction, String summary, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        StringJoiner line = new StringJoiner(", ");
        if (summary != null && !summary.isEmpty()) {
            line.add(summary);
        }
        if (details != null) {
            for (int i = 0; i + 1 < details.length; i += 2) {
                line.add(details[i] + "=" + details[i + 1]);
            }
        }
        if (line.length() > 0) {
            logger.debug("  ({}) {}: {}", callId, direction, line);
        }
    }
}
