package com.naagi.ragflow.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naagi.ragflow.json.Json;
import com.naagi.ragflow.tools.EmbeddingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class OpenAIEmbeddingsClient implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final HttpClient http;
    private final Duration requestTimeout;

    public OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey, HttpClient http, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Double> embed(String text) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode()
                    .put("model", model)
                    .put("input", text);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new RuntimeException("OpenAI-compatible embed HTTP " + resp.statusCode() + ": " + resp.body());
            }

            JsonNode data = Json.MAPPER.readTree(resp.body()).get("data");
            if (data == null || !data.isArray() || data.size() == 0) {
                throw new IllegalStateException("Bad embed response: missing data array");
            }
            JsonNode vec = data.get(0).get("embedding");
            if (vec == null || !vec.isArray()) {
                throw new IllegalStateException("Bad embed response: missing embedding array");
            }

            List<Double> out = new ArrayList<>(vec.size());
            for (JsonNode n : vec) out.add(n.asDouble());

            log.debug("[EMBED TIMING] total={}ms textLen={} dim={}",
                    System.currentTimeMillis() - startTime, text.length(), out.size());
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("OpenAI-compatible embedding interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("OpenAI-compatible embedding failed: " + e.getMessage(), e);
        }
    }
}
