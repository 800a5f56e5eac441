package com.naagi.ragflow.llm;

import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.tools.RelevanceScorer;

/**
 * Asks the chat model for a 0-100 relevance score. The raw reply is returned as is.
 */
public class LlmRelevanceScorer implements RelevanceScorer {

    private static final int MAX_CHUNK_CHARS = 800;

    private final ChatClient chatClient;

    public LlmRelevanceScorer(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String score(String question, RetrievedChunk chunk) {
        String text = chunk.content().length() <= MAX_CHUNK_CHARS
                ? chunk.content()
                : chunk.content().substring(0, MAX_CHUNK_CHARS) + "...";
        String prompt = """
                Rate how relevant the document is to the query on a scale of 0 to 100.
                Only respond with a single integer, nothing else.

                Query: %s

                Document: %s

                Relevance score (0-100):""".formatted(question, text);
        return chatClient.chatOnce(prompt, 0.0, 5);
    }
}
