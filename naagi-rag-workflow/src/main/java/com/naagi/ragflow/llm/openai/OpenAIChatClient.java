package com.naagi.ragflow.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naagi.ragflow.json.Json;
import com.naagi.ragflow.llm.ChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Chat completions against any OpenAI-compatible server (llama.cpp, Ollama, vLLM, OpenAI).
 */
public final class OpenAIChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIChatClient.class);

    private static final String SYSTEM_PROMPT = "You are a precise assistant for an internal knowledge base. "
            + "Follow the output format requested in the user message exactly.";

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final HttpClient http;
    private final Duration requestTimeout;

    public OpenAIChatClient(String baseUrl, String model, String apiKey, HttpClient http, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String chatOnce(String userPrompt, double temperature, int maxTokens) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("model", model);
            body.put("temperature", temperature);
            body.put("max_tokens", maxTokens);
            body.put("stream", false);

            ArrayNode messages = body.putArray("messages");
            messages.addObject()
                    .put("role", "system")
                    .put("content", SYSTEM_PROMPT);
            messages.addObject()
                    .put("role", "user")
                    .put("content", userPrompt);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            long httpStart = System.currentTimeMillis();
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            long httpTime = System.currentTimeMillis() - httpStart;

            if (resp.statusCode() / 100 != 2) {
                throw new RuntimeException("OpenAI-compatible chat HTTP " + resp.statusCode() + ": " + resp.body());
            }

            JsonNode content = Json.MAPPER.readTree(resp.body()).at("/choices/0/message/content");
            log.debug("[CHAT TIMING] total={}ms (http={}ms) promptLen={} maxTokens={}",
                    System.currentTimeMillis() - startTime, httpTime, userPrompt.length(), maxTokens);

            if (!content.isTextual()) {
                throw new IllegalStateException("Bad chat response: missing message content");
            }
            return content.asText();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("OpenAI-compatible chat interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("OpenAI-compatible chat failed: " + e.getMessage(), e);
        }
    }
}
