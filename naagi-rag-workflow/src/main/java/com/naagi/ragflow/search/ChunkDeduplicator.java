package com.naagi.ragflow.search;

import com.naagi.ragflow.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes repeated chunk identities, keeping the highest-scored instance of each.
 * The result keeps the order in which identities first appeared.
 */
public final class ChunkDeduplicator {

    private ChunkDeduplicator() {}

    public static List<RetrievedChunk> deduplicate(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        Map<String, RetrievedChunk> best = new LinkedHashMap<>();
        for (RetrievedChunk chunk : chunks) {
            best.merge(chunk.identity().key(), chunk,
                    (kept, candidate) -> candidate.score() > kept.score() ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }
}
