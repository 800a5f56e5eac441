package com.naagi.ragflow.tools;

import com.naagi.ragflow.model.RetrievedChunk;

import java.util.List;

public interface VectorStore {

    /**
     * Semantic search in one collection. Results are ordered best first and carry
     * the similarity as {@link RetrievedChunk#score()}.
     */
    List<RetrievedChunk> query(String collection, List<Double> vector, int k);
}
