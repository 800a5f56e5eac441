package com.naagi.ragflow.workflow;

import java.util.Map;

/**
 * Receives human-readable progress messages for a running request (UI activity panels, audit).
 */
@FunctionalInterface
public interface ActivitySink {

    ActivitySink NOOP = (message, type, metadata) -> { };

    void log(String message, String type, Map<String, Object> metadata);

    default void info(String message) {
        log(message, "processing", Map.of());
    }
}
