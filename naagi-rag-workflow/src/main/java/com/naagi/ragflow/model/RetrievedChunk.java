package com.naagi.ragflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved passage.
 *
 * @param source   document identifier (file name, doc id)
 * @param position chunk index inside the source
 * @param content  passage text
 * @param score    similarity in [0,1], higher is better
 * @param metadata free-form payload from the index
 */
public record RetrievedChunk(
        String source,
        int position,
        String content,
        double score,
        Map<String, Object> metadata
) {
    public RetrievedChunk {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Chunk source must not be blank");
        }
        content = content == null ? "" : content;
        score = Math.max(0.0, Math.min(1.0, score));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RetrievedChunk of(String source, int position, String content, double score) {
        return new RetrievedChunk(source, position, content, score, Map.of());
    }

    /**
     * Distance view of the score (0 = perfect match, 1 = worst).
     */
    @JsonIgnore
    public double distance() {
        return 1.0 - score;
    }

    @JsonIgnore
    public ChunkIdentity identity() {
        return new ChunkIdentity(source, position);
    }

    public RetrievedChunk withScore(double newScore) {
        return new RetrievedChunk(source, position, content, newScore, metadata);
    }
}
