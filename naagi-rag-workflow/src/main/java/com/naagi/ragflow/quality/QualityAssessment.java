package com.naagi.ragflow.quality;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of judging one retrieval round.
 */
public record QualityAssessment(
        int chunkCount,
        double averageScore,
        double topScore,
        double scoreVariance,
        double confidence,     // 0.0 to 1.0, informational only
        boolean fastPath,      // true when the held chunks are good enough to skip hybrid search
        String reason
) {

    public Map<String, Object> toLogDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("chunk_count", chunkCount);
        details.put("avg_similarity", averageScore);
        details.put("top_score", topScore);
        details.put("score_variance", scoreVariance);
        details.put("confidence", confidence);
        details.put("fast_path", fastPath);
        details.put("reason", reason);
        return details;
    }
}
