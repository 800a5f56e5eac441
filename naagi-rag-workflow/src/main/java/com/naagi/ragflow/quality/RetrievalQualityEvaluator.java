package com.naagi.ragflow.quality;

import com.naagi.ragflow.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides from chunk count and similarity whether the semantic results are used as they are
 * (fast path) or escalated to hybrid search with reranking.
 *
 * Signals:
 * 1. Chunk count against the configured minimum
 * 2. Average similarity against the configured minimum
 * 3. Top score and variance, folded into a confidence value for the step log
 */
public class RetrievalQualityEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalQualityEvaluator.class);

    private final int minChunks;
    private final double minAverageSimilarity;

    public RetrievalQualityEvaluator(int minChunks, double minAverageSimilarity) {
        this.minChunks = minChunks;
        this.minAverageSimilarity = minAverageSimilarity;
        log.info("[QUALITY] Evaluator initialized: minChunks={}, minAvgSimilarity={}", minChunks, minAverageSimilarity);
    }

    public QualityAssessment evaluate(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return new QualityAssessment(0, 0.0, 0.0, 0.0, 0.0, false, "No chunks retrieved");
        }

        double topScore = chunks.stream().mapToDouble(RetrievedChunk::score).max().orElse(0.0);
        double avgScore = chunks.stream().mapToDouble(RetrievedChunk::score).average().orElse(0.0);
        double variance = calculateVariance(chunks, avgScore);
        double confidence = calculateConfidence(topScore, avgScore, variance, chunks.size());

        boolean enoughChunks = chunks.size() >= minChunks;
        boolean similarEnough = avgScore >= minAverageSimilarity;
        boolean fastPath = enoughChunks && similarEnough;

        String reason = buildReason(chunks.size(), avgScore, enoughChunks, similarEnough);
        log.info("[QUALITY] count={}, avg={}, top={}, variance={}, fastPath={}",
                chunks.size(), String.format("%.3f", avgScore), String.format("%.3f", topScore),
                String.format("%.4f", variance), fastPath);

        return new QualityAssessment(chunks.size(), avgScore, topScore, variance, confidence, fastPath, reason);
    }

    private double calculateVariance(List<RetrievedChunk> chunks, double mean) {
        if (chunks.size() < 2) return 0.0;
        return chunks.stream()
                .mapToDouble(c -> Math.pow(c.score() - mean, 2))
                .average()
                .orElse(0.0);
    }

    private double calculateConfidence(double topScore, double avgScore, double variance, int count) {
        double variancePenalty = Math.min(0.2, variance * 0.5);
        double consistencyBonus = avgScore > 0.6 && variance < 0.05 ? 0.05 : 0.0;
        double countPenalty = count < minChunks ? 0.05 : 0.0;
        double confidence = topScore - variancePenalty + consistencyBonus - countPenalty;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private String buildReason(int count, double avgScore, boolean enoughChunks, boolean similarEnough) {
        if (enoughChunks && similarEnough) {
            return String.format("%d chunks, avg similarity %.3f", count, avgScore);
        }
        StringBuilder reason = new StringBuilder();
        if (!enoughChunks) {
            reason.append("only ").append(count).append(" chunks (< ").append(minChunks).append(")");
        }
        if (!similarEnough) {
            if (reason.length() > 0) reason.append(", ");
            reason.append(String.format("avg similarity %.3f < %.2f", avgScore, minAverageSimilarity));
        }
        return reason.toString();
    }

    public int getMinChunks() {
        return minChunks;
    }

    public double getMinAverageSimilarity() {
        return minAverageSimilarity;
    }
}
