package com.naagi.ragflow.cache;

import java.util.Optional;

/**
 * Outcome of a cache lookup. A miss carries no answer.
 */
public record CacheLookup(MatchType matchType, String answer, double similarity) {

    public enum MatchType {
        EXACT,
        FUZZY,
        HISTORY,
        MISS
    }

    private static final CacheLookup MISS = new CacheLookup(MatchType.MISS, null, 0.0);

    public static CacheLookup miss() {
        return MISS;
    }

    public boolean isHit() {
        return matchType != MatchType.MISS;
    }

    public Optional<String> answerIfHit() {
        return isHit() ? Optional.ofNullable(answer) : Optional.empty();
    }
}
