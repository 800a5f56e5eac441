package com.naagi.ragflow.cache;

import java.util.Locale;

/**
 * Compares two questions for cache lookups.
 *
 * <p>{@link #similarity(String, String)} must be symmetric, return 1.0 for identical
 * inputs and 0.0 for inputs that share nothing.
 */
public interface SimilarityMatcher {

    /**
     * Ratio in [0,1] between two already normalized strings.
     */
    double similarity(String left, String right);

    /**
     * Lowercased, trimmed, inner whitespace collapsed.
     */
    default String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    default boolean exactMatch(String left, String right) {
        return normalize(left).equals(normalize(right));
    }
}
