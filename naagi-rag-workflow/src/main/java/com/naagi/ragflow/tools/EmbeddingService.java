package com.naagi.ragflow.tools;

import java.util.List;

public interface EmbeddingService {

    /**
     * Fixed-length vector for the given text.
     */
    List<Double> embed(String text);
}
