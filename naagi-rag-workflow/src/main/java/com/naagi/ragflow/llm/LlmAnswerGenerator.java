package com.naagi.ragflow.llm;

import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.tools.AnswerGenerator;

import java.util.List;

/**
 * Grounded answer synthesis with numbered [n] citation markers.
 */
public class LlmAnswerGenerator implements AnswerGenerator {

    private static final int MAX_CHUNK_CHARS = 1500;

    private final ChatClient chatClient;
    private final double temperature;
    private final int maxTokens;

    public LlmAnswerGenerator(ChatClient chatClient, double temperature, int maxTokens) {
        this.chatClient = chatClient;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String generate(String question, List<RetrievedChunk> chunks, String historySummary) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            String text = chunk.content();
            if (text.length() > MAX_CHUNK_CHARS) {
                text = text.substring(0, MAX_CHUNK_CHARS) + "...";
            }
            context.append('[').append(i + 1).append("] (").append(chunk.source()).append(")\n")
                    .append(text).append("\n\n");
        }

        String prompt = """
                Answer the question using only the numbered context passages below.
                Cite the passages you use with their markers, e.g. [1] or [2][3].
                If the context does not contain the answer, say so plainly.
                Answer in the language of the question.

                Conversation so far:
                %s

                Context:
                %s
                Question: %s
                """.formatted(historySummary == null || historySummary.isBlank() ? "(none)" : historySummary,
                context, question);

        return chatClient.chatOnce(prompt, temperature, maxTokens);
    }
}
