package com.helix.guardrails.knowledge;

import com.helix.guardrails.exception.TransientIoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the graph indexes once the context is up. An unreachable graph store is
 * logged, not fatal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphIndexInitializer {

    private final GraphStore graphStore;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        try {
            graphStore.ensureIndexes();
        } catch (TransientIoException e) {
            log.warn("Could not ensure Neo4j indexes at startup: {}", e.getMessage());
        }
    }
}
