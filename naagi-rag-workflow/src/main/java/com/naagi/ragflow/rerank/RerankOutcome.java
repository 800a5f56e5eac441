package com.naagi.ragflow.rerank;

import com.naagi.ragflow.model.RetrievedChunk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reordered chunks plus the score summary reported in the step's log entry.
 */
public record RerankOutcome(
        List<RetrievedChunk> chunks,
        List<Integer> scores,       // aligned with chunks, 0-100
        double averageScore,        // over parsed scores only
        int topScore,
        int unparsedCount
) {
    public RerankOutcome {
        chunks = List.copyOf(chunks);
        scores = List.copyOf(scores);
    }

    public static RerankOutcome empty() {
        return new RerankOutcome(List.of(), List.of(), 0.0, 0, 0);
    }

    public Map<String, Object> toLogDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rerank_count", chunks.size());
        details.put("rerank_avg_score", averageScore);
        details.put("rerank_top_score", topScore);
        details.put("rerank_unparsed", unparsedCount);
        return details;
    }
}
