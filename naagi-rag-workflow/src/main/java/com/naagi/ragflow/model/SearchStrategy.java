package com.naagi.ragflow.model;

public enum SearchStrategy {
    FAST_PATH,  // semantic results good enough on their own
    HYBRID,     // semantic + keyword fusion, optionally reranked
    FALLBACK    // category widened to all collections
}
