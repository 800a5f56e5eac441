package com.naagi.ragflow.cache;

import com.naagi.ragflow.exception.CacheException;
import com.naagi.ragflow.model.ConversationTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, process-wide store of (question -> answer) pairs scoped per session.
 *
 * <p>Lookup is two-tier: exact match on the normalized question first, then the best
 * fuzzy match at or above the similarity threshold. When the session has no entry the
 * caller's own conversation history is scanned for a matching user/assistant pair.
 * Eviction is FIFO by creation order once {@code capacity} is exceeded.
 */
public class ConversationCache {

    private static final Logger log = LoggerFactory.getLogger(ConversationCache.class);

    private final SimilarityMatcher matcher;
    private final int capacity;
    private final double similarityThreshold;

    // insertion ordered: the eldest entry is the first one created
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    public ConversationCache(SimilarityMatcher matcher, int capacity, double similarityThreshold) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in (0,1]: " + similarityThreshold);
        }
        this.matcher = matcher;
        this.capacity = capacity;
        this.similarityThreshold = similarityThreshold;
        log.info("[CACHE] ConversationCache initialized: capacity={}, similarityThreshold={}",
                capacity, similarityThreshold);
    }

    public CacheLookup lookup(String sessionId, String question) {
        return lookup(sessionId, question, List.of());
    }

    public synchronized CacheLookup lookup(String sessionId, String question, List<ConversationTurn> history) {
        try {
            String normalized = matcher.normalize(question);
            if (normalized.isEmpty()) {
                return CacheLookup.miss();
            }

            CacheEntry exact = entries.get(key(sessionId, normalized));
            if (exact != null) {
                exact.recordHit();
                log.debug("[CACHE] Exact hit for session={} (hits={})", sessionId, exact.getHitCount());
                return new CacheLookup(CacheLookup.MatchType.EXACT, exact.getAnswerText(), 1.0);
            }

            CacheEntry best = null;
            double bestRatio = 0.0;
            for (CacheEntry entry : entries.values()) {
                if (!entry.getSessionId().equals(sessionKey(sessionId))) {
                    continue;
                }
                double ratio = matcher.similarity(normalized, entry.getNormalizedQuestion());
                if (ratio >= similarityThreshold && ratio > bestRatio) {
                    best = entry;
                    bestRatio = ratio;
                }
            }
            if (best != null) {
                best.recordHit();
                log.debug("[CACHE] Fuzzy hit for session={} ratio={}", sessionId, String.format("%.3f", bestRatio));
                return new CacheLookup(CacheLookup.MatchType.FUZZY, best.getAnswerText(), bestRatio);
            }

            return lookupHistory(normalized, history);
        } catch (RuntimeException e) {
            throw new CacheException("Cache lookup failed: " + e.getMessage(), e);
        }
    }

    /**
     * Store an answer. Re-recording a known question replaces its answer but keeps its
     * original position in the eviction order.
     */
    public synchronized void record(String sessionId, String question, String answer) {
        try {
            String normalized = matcher.normalize(question);
            if (normalized.isEmpty() || answer == null || answer.isBlank()) {
                return;
            }
            String key = key(sessionId, normalized);
            CacheEntry existing = entries.get(key);
            if (existing != null) {
                existing.replaceAnswer(answer);
                return;
            }
            entries.put(key, new CacheEntry(sessionKey(sessionId), normalized, answer, Instant.now()));
            evictOverflow();
        } catch (RuntimeException e) {
            throw new CacheException("Cache write failed: " + e.getMessage(), e);
        }
    }

    /**
     * Drop every entry of a session.
     *
     * @return number of entries removed
     */
    public synchronized int resetSession(String sessionId) {
        String session = sessionKey(sessionId);
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().getSessionId().equals(session)) {
                it.remove();
                removed++;
            }
        }
        log.info("[CACHE] Reset session={} removed={} entries", sessionId, removed);
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized Map<String, Object> getStats() {
        int totalHits = entries.values().stream().mapToInt(CacheEntry::getHitCount).sum();
        return Map.of(
                "entries", entries.size(),
                "capacity", capacity,
                "similarityThreshold", similarityThreshold,
                "totalHits", totalHits
        );
    }

    private CacheLookup lookupHistory(String normalizedQuestion, List<ConversationTurn> history) {
        if (history == null || history.size() < 2) {
            return CacheLookup.miss();
        }
        CacheLookup best = CacheLookup.miss();
        for (int i = 0; i + 1 < history.size(); i++) {
            ConversationTurn asked = history.get(i);
            ConversationTurn answered = history.get(i + 1);
            if (asked.role() != ConversationTurn.Role.USER
                    || answered.role() != ConversationTurn.Role.ASSISTANT
                    || answered.content().isBlank()) {
                continue;
            }
            double ratio = matcher.similarity(normalizedQuestion, matcher.normalize(asked.content()));
            if (ratio >= similarityThreshold && ratio >= best.similarity()) {
                // later pairs win ties so the most recent answer is reused
                best = new CacheLookup(CacheLookup.MatchType.HISTORY, answered.content(), ratio);
            }
        }
        if (best.isHit()) {
            log.debug("[CACHE] History hit ratio={}", String.format("%.3f", best.similarity()));
        }
        return best;
    }

    private void evictOverflow() {
        Iterator<CacheEntry> it = entries.values().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            CacheEntry evicted = it.next();
            it.remove();
            log.debug("[CACHE] Evicted oldest entry of session={}", evicted.getSessionId());
        }
    }

    private static String sessionKey(String sessionId) {
        return sessionId == null ? "" : sessionId;
    }

    private static String key(String sessionId, String normalizedQuestion) {
        return sessionKey(sessionId) + "::" + normalizedQuestion;
    }
}
