package com.naagi.ragflow.qdrant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naagi.ragflow.json.Json;
import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.model.WorkflowState;
import com.naagi.ragflow.tools.KeywordSearch;
import com.naagi.ragflow.tools.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Qdrant REST adapter for both semantic search and payload full-text match.
 *
 * Category collections are addressed by name ({@code cat_<slug>}); the "all" sentinel maps to
 * the configured aggregate collection. Payload fields: docId, chunkIndex, text, title.
 */
public final class QdrantClient implements VectorStore, KeywordSearch {
    private static final Logger log = LoggerFactory.getLogger(QdrantClient.class);

    private final String baseUrl;
    private final String allCollection;
    private final HttpClient http;
    private final Duration requestTimeout;

    public QdrantClient(String baseUrl, String allCollection, HttpClient http, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.allCollection = allCollection;
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<RetrievedChunk> query(String collection, List<Double> vector, int k) {
        long startTime = System.currentTimeMillis();
        String target = resolve(collection);
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("vector", toArray(vector));
            body.put("limit", k);
            body.put("with_payload", true);

            HttpResponse<String> resp = post("/collections/" + target + "/points/search", body);
            if (resp.statusCode() == 404) {
                log.info("[QDRANT] Collection {} does not exist, no results", target);
                return List.of();
            }
            if (resp.statusCode() / 100 != 2) {
                throw new RuntimeException("Qdrant search HTTP " + resp.statusCode() + ": " + resp.body());
            }
            List<RetrievedChunk> results = parseHits(resp.body(), true);
            log.debug("[QDRANT TIMING] search {}ms collection={} topK={} hits={}",
                    System.currentTimeMillis() - startTime, target, k, results.size());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Qdrant search interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("Qdrant search failed: " + e.getMessage(), e);
        }
    }

    /**
     * Full-text payload match on the "text" field. Qdrant's scroll API returns no score, so
     * hits are scored by their returned order.
     */
    @Override
    public List<RetrievedChunk> search(String collection, String query, int k) {
        long startTime = System.currentTimeMillis();
        String target = resolve(collection);
        try {
            ObjectNode match = Json.MAPPER.createObjectNode().put("text", query);
            ObjectNode condition = Json.MAPPER.createObjectNode().put("key", "text");
            condition.set("match", match);
            ObjectNode filter = Json.MAPPER.createObjectNode();
            filter.set("must", Json.MAPPER.createArrayNode().add(condition));

            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("filter", filter);
            body.put("limit", k);
            body.put("with_payload", true);
            body.put("with_vector", false);

            HttpResponse<String> resp = post("/collections/" + target + "/points/scroll", body);
            if (resp.statusCode() == 404) {
                return List.of();
            }
            if (resp.statusCode() / 100 != 2) {
                throw new RuntimeException("Qdrant scroll HTTP " + resp.statusCode() + ": " + resp.body());
            }
            List<RetrievedChunk> results = parseHits(resp.body(), false);
            log.debug("[QDRANT TIMING] keyword {}ms collection={} k={} hits={}",
                    System.currentTimeMillis() - startTime, target, k, results.size());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Qdrant keyword search interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("Qdrant keyword search failed: " + e.getMessage(), e);
        }
    }

    private String resolve(String collection) {
        return WorkflowState.ALL_CATEGORIES.equals(collection) ? allCollection : collection;
    }

    private HttpResponse<String> post(String path, ObjectNode body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static ArrayNode toArray(List<Double> v) {
        ArrayNode a = Json.MAPPER.createArrayNode();
        for (Double d : v) a.add(d);
        return a;
    }

    static List<RetrievedChunk> parseHits(String json, boolean scored) throws Exception {
        JsonNode root = Json.MAPPER.readTree(json);
        JsonNode result = root.get("result");
        // scroll wraps its hits in result.points
        JsonNode hits = result != null && result.has("points") ? result.get("points") : result;
        if (hits == null || !hits.isArray()) return List.of();

        List<RetrievedChunk> out = new ArrayList<>();
        int total = hits.size();
        int rank = 0;
        for (JsonNode hit : hits) {
            JsonNode payload = hit.get("payload");
            rank++;
            if (payload == null || !payload.hasNonNull("docId") || !payload.hasNonNull("text")) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (payload.hasNonNull("title")) metadata.put("title", payload.get("title").asText());
            if (hit.hasNonNull("id")) metadata.put("point_id", hit.get("id").asText());

            double score = scored
                    ? hit.path("score").asDouble(0.0)
                    : 1.0 - (double) (rank - 1) / Math.max(1, total);
            out.add(new RetrievedChunk(
                    payload.get("docId").asText(),
                    payload.path("chunkIndex").asInt(0),
                    payload.get("text").asText(),
                    score,
                    metadata));
        }
        return out;
    }
}
