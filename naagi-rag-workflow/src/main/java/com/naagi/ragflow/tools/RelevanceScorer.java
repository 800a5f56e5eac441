package com.naagi.ragflow.tools;

import com.naagi.ragflow.model.RetrievedChunk;

public interface RelevanceScorer {

    /**
     * Raw relevance verdict for one chunk, expected to contain an integer between 0 and 100.
     * The reranker parses it and tolerates malformed output.
     */
    String score(String question, RetrievedChunk chunk);
}
