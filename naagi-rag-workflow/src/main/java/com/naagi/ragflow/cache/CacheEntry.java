package com.naagi.ragflow.cache;

import lombok.Getter;

import java.time.Instant;

/**
 * Cached answer for one normalized question of one session.
 */
@Getter
public class CacheEntry {

    private final String sessionId;
    private final String normalizedQuestion;
    private final Instant createdAt;
    private String answerText;
    private int hitCount;

    CacheEntry(String sessionId, String normalizedQuestion, String answerText, Instant createdAt) {
        this.sessionId = sessionId;
        this.normalizedQuestion = normalizedQuestion;
        this.answerText = answerText;
        this.createdAt = createdAt;
    }

    void replaceAnswer(String answerText) {
        this.answerText = answerText;
    }

    void recordHit() {
        this.hitCount++;
    }
}
