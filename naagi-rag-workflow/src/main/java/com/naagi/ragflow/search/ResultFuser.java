package com.naagi.ragflow.search;

import com.naagi.ragflow.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges semantic (dense) and keyword (sparse) result lists with a weighted linear combination.
 *
 * Each list is min-max normalized to [0,1] first, since cosine similarities and lexical
 * scores live on different scales. A chunk found in both lists scores
 * {@code semanticWeight * s + keywordWeight * k}; a chunk found in one list only gets that
 * list's weighted score. Weights are non-negative and sum to at most 1, so a discount is allowed.
 *
 * Ties on the combined score are broken by semantic rank (chunks missing from the semantic
 * list come after those present), then by keyword rank.
 */
public class ResultFuser {

    private static final Logger log = LoggerFactory.getLogger(ResultFuser.class);
    private static final double WEIGHT_EPSILON = 1e-9;

    private final double semanticWeight;
    private final double keywordWeight;

    public ResultFuser(double semanticWeight, double keywordWeight) {
        validateWeights(semanticWeight, keywordWeight);
        this.semanticWeight = semanticWeight;
        this.keywordWeight = keywordWeight;
    }

    /**
     * Fused entry with the combined score and where it came from.
     */
    public record FusedResult(
            RetrievedChunk chunk,       // carries the combined score
            double semanticScore,       // normalized, 0 when absent
            double keywordScore,        // normalized, 0 when absent
            int semanticRank,           // 0-based, -1 when absent
            int keywordRank             // 0-based, -1 when absent
    ) {
        public boolean inBoth() {
            return semanticRank >= 0 && keywordRank >= 0;
        }
    }

    public List<RetrievedChunk> fuse(List<RetrievedChunk> semanticResults, List<RetrievedChunk> keywordResults, int finalK) {
        return fuse(semanticResults, keywordResults, semanticWeight, keywordWeight, finalK).stream()
                .map(FusedResult::chunk)
                .toList();
    }

    public List<FusedResult> fuse(
            List<RetrievedChunk> semanticResults,
            List<RetrievedChunk> keywordResults,
            double semanticWeight,
            double keywordWeight,
            int finalK) {

        validateWeights(semanticWeight, keywordWeight);
        List<RetrievedChunk> semantic = semanticResults == null ? List.of() : semanticResults;
        List<RetrievedChunk> keyword = keywordResults == null ? List.of() : keywordResults;
        if (finalK <= 0 || (semantic.isEmpty() && keyword.isEmpty())) {
            return List.of();
        }

        Map<String, Double> normalizedSemantic = normalizeScores(semantic);
        Map<String, Double> normalizedKeyword = normalizeScores(keyword);

        // first occurrence wins for content; semantic instance preferred
        Map<String, RetrievedChunk> hitMap = new LinkedHashMap<>();
        Map<String, Integer> semanticRanks = new HashMap<>();
        Map<String, Integer> keywordRanks = new HashMap<>();

        for (int rank = 0; rank < semantic.size(); rank++) {
            String id = semantic.get(rank).identity().key();
            hitMap.putIfAbsent(id, semantic.get(rank));
            semanticRanks.putIfAbsent(id, rank);
        }
        for (int rank = 0; rank < keyword.size(); rank++) {
            String id = keyword.get(rank).identity().key();
            hitMap.putIfAbsent(id, keyword.get(rank));
            keywordRanks.putIfAbsent(id, rank);
        }

        List<FusedResult> fused = new ArrayList<>(hitMap.size());
        for (Map.Entry<String, RetrievedChunk> entry : hitMap.entrySet()) {
            String id = entry.getKey();
            double s = normalizedSemantic.getOrDefault(id, 0.0);
            double k = normalizedKeyword.getOrDefault(id, 0.0);
            double combined = semanticWeight * s + keywordWeight * k;
            fused.add(new FusedResult(
                    entry.getValue().withScore(combined),
                    s,
                    k,
                    semanticRanks.getOrDefault(id, -1),
                    keywordRanks.getOrDefault(id, -1)
            ));
        }

        fused.sort(Comparator
                .comparingDouble((FusedResult r) -> r.chunk().score()).reversed()
                .thenComparingInt(r -> rankOrLast(r.semanticRank()))
                .thenComparingInt(r -> rankOrLast(r.keywordRank())));

        List<FusedResult> results = fused.size() > finalK ? List.copyOf(fused.subList(0, finalK)) : List.copyOf(fused);

        long bothCount = results.stream().filter(FusedResult::inBoth).count();
        log.debug("[FUSION] semantic={}, keyword={} -> {} results ({} in both lists, weights {}/{})",
                semantic.size(), keyword.size(), results.size(), bothCount, semanticWeight, keywordWeight);

        return results;
    }

    /**
     * Min-max normalize scores to [0,1]. Constant scores normalize to 1.0.
     * The best score per identity is used when a list repeats an identity.
     */
    static Map<String, Double> normalizeScores(List<RetrievedChunk> results) {
        if (results.isEmpty()) {
            return Map.of();
        }

        double minScore = results.stream().mapToDouble(RetrievedChunk::score).min().orElse(0);
        double maxScore = results.stream().mapToDouble(RetrievedChunk::score).max().orElse(1);
        double range = maxScore - minScore;

        Map<String, Double> normalized = new HashMap<>();
        for (RetrievedChunk chunk : results) {
            double value = range == 0 ? 1.0 : (chunk.score() - minScore) / range;
            normalized.merge(chunk.identity().key(), value, Math::max);
        }
        return normalized;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    private static int rankOrLast(int rank) {
        return rank < 0 ? Integer.MAX_VALUE : rank;
    }

    private static void validateWeights(double semanticWeight, double keywordWeight) {
        if (semanticWeight < 0 || keywordWeight < 0) {
            throw new IllegalArgumentException("Fusion weights must be non-negative");
        }
        if (semanticWeight + keywordWeight > 1.0 + WEIGHT_EPSILON) {
            throw new IllegalArgumentException("Fusion weights must sum to at most 1, got "
                    + (semanticWeight + keywordWeight));
        }
    }
}
