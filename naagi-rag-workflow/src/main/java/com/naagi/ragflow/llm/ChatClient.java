package com.naagi.ragflow.llm;

public interface ChatClient {
    String chatOnce(String userPrompt, double temperature, int maxTokens);
}
