package com.naagi.ragflow.tools;

import com.naagi.ragflow.model.RetrievedChunk;

import java.util.List;

public interface AnswerGenerator {

    /**
     * Synthesizes an answer grounded in the chunks, using [n] markers that refer to
     * the 1-based chunk order.
     */
    String generate(String question, List<RetrievedChunk> chunks, String historySummary);
}
