package com.naagi.ragflow.tools;

import com.naagi.ragflow.model.RetrievedChunk;

import java.util.List;

public interface KeywordSearch {

    /**
     * Lexical search in one collection. Scores are source-specific; the fuser normalizes them.
     */
    List<RetrievedChunk> search(String collection, String query, int k);
}
