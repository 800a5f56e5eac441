package com.naagi.ragflow.model;

/**
 * Citation metadata for one chunk retained in the final answer.
 */
public record CitationSource(
        int index,        // 1-based, matches the [n] markers in the answer
        String source,
        double distance,  // 0 = perfect, 1 = worst
        String preview
) {}
