package com.naagi.ragflow.tools;

/**
 * Result of category routing.
 */
public record CategoryDecision(String category, double confidence, String reason) {

    public CategoryDecision {
        reason = reason == null ? "" : reason;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
