package com.naagi.ragflow.rerank;

import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.tools.RelevanceScorer;
import com.naagi.ragflow.workflow.ExecutionContext;
import com.naagi.ragflow.workflow.ToolInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-ranks candidate chunks with an external 0-100 relevance score.
 *
 * Scoring flow:
 * 1. Every (question, chunk) pair is scored concurrently
 * 2. The first integer in each response is the score, clamped to 0-100
 * 3. Chunks sort by score descending; unparseable or failed scores count as 0 and go last
 *
 * Ties keep the input order, so a deterministic scorer gives a deterministic ordering.
 */
public class Reranker {

    private static final Logger log = LoggerFactory.getLogger(Reranker.class);
    private static final Pattern FIRST_INTEGER = Pattern.compile("-?\\d+");
    static final String TOOL = "relevance_scorer";

    private final RelevanceScorer scorer;
    private final ToolInvoker toolInvoker;
    private final Duration timeout;

    public Reranker(RelevanceScorer scorer, ToolInvoker toolInvoker, Duration timeout) {
        this.scorer = scorer;
        this.toolInvoker = toolInvoker;
        this.timeout = timeout;
    }

    public RerankOutcome rerank(ExecutionContext context, String question, List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return RerankOutcome.empty();
        }
        long startTime = System.currentTimeMillis();

        List<CompletableFuture<String>> pending = new ArrayList<>(chunks.size());
        for (RetrievedChunk chunk : chunks) {
            pending.add(toolInvoker.submit(context, TOOL, timeout, () -> scorer.score(question, chunk)));
        }

        List<Scored> scored = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Integer score;
            try {
                score = parseScore(toolInvoker.await(pending.get(i), TOOL, timeout));
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[RERANK] Scoring failed for {}: {}", chunks.get(i).identity().key(), e.getMessage());
                score = null;
            }
            scored.add(new Scored(i, chunks.get(i), score));
        }

        scored.sort(Comparator
                .comparing((Scored s) -> s.parsed() ? 0 : 1)
                .thenComparing(Comparator.comparingInt(Scored::value).reversed())
                .thenComparingInt(Scored::originalIndex));

        List<RetrievedChunk> ordered = new ArrayList<>(scored.size());
        List<Integer> scores = new ArrayList<>(scored.size());
        int parsedCount = 0;
        int total = 0;
        int top = 0;
        for (Scored s : scored) {
            ordered.add(s.chunk().withScore(s.value() / 100.0));
            scores.add(s.value());
            if (s.parsed()) {
                parsedCount++;
                total += s.value();
                top = Math.max(top, s.value());
            }
        }
        double average = parsedCount == 0 ? 0.0 : (double) total / parsedCount;
        int unparsed = scored.size() - parsedCount;

        log.info("[RERANK TIMING] {}ms for {} chunks (avg={}, top={}, unparsed={})",
                System.currentTimeMillis() - startTime, chunks.size(),
                String.format("%.1f", average), top, unparsed);
        return new RerankOutcome(ordered, scores, average, top, unparsed);
    }

    /**
     * @return the clamped score, or null when the text holds no integer
     */
    static Integer parseScore(String response) {
        if (response == null) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER.matcher(response);
        if (!matcher.find()) {
            return null;
        }
        try {
            int value = Integer.parseInt(matcher.group());
            return Math.max(0, Math.min(100, value));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return matcher.group().startsWith("-") ? 0 : 100;
        }
    }

    private record Scored(int originalIndex, RetrievedChunk chunk, Integer score) {
        boolean parsed() {
            return score != null;
        }

        int value() {
            return score == null ? 0 : score;
        }
    }
}
