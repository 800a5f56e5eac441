package com.naagi.ragflow.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.naagi.ragflow.json.Json;
import com.naagi.ragflow.tools.CategoryDecision;
import com.naagi.ragflow.tools.CategoryRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Asks the chat model to pick one of the available categories and answer in JSON.
 */
public class LlmCategoryRouter implements CategoryRouter {

    private static final Logger log = LoggerFactory.getLogger(LlmCategoryRouter.class);

    private final ChatClient chatClient;

    public LlmCategoryRouter(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public CategoryDecision route(String question, List<String> availableCategories, String conversationContext) {
        String prompt = """
                Pick the document category that best fits the user's question.

                Available categories: %s

                Recent conversation:
                %s

                Question: %s

                Respond with JSON only:
                {"category": "<one of the available categories>", "confidence": <0.0-1.0>, "reason": "<short reason>"}
                """.formatted(String.join(", ", availableCategories),
                conversationContext == null || conversationContext.isBlank() ? "(none)" : conversationContext,
                question);

        String response = chatClient.chatOnce(prompt, 0.0, 150);
        CategoryDecision decision = parse(response, availableCategories);
        log.debug("[ROUTER] '{}' -> {} ({})", question, decision.category(), decision.confidence());
        return decision;
    }

    static CategoryDecision parse(String response, List<String> availableCategories) {
        String text = response == null ? "" : response.trim();
        int firstBrace = text.indexOf('{');
        int lastBrace = text.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            try {
                JsonNode node = Json.MAPPER.readTree(text.substring(firstBrace, lastBrace + 1));
                String category = matchCategory(node.path("category").asText(""), availableCategories);
                return new CategoryDecision(category, node.path("confidence").asDouble(0.5), node.path("reason").asText(""));
            } catch (Exception e) {
                log.warn("[ROUTER] Could not parse router JSON: {}", e.getMessage());
            }
        }
        // plain-text answer: accept it when it names a category
        return new CategoryDecision(matchCategory(text, availableCategories), 0.5, "unstructured router answer");
    }

    /**
     * Maps the model's spelling to the canonical category name; unknown names are returned unchanged.
     */
    private static String matchCategory(String raw, List<String> availableCategories) {
        String candidate = raw.trim().replace("\"", "");
        for (String category : availableCategories) {
            if (category.equalsIgnoreCase(candidate)) {
                return category;
            }
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (String category : availableCategories) {
            if (lower.contains(category.toLowerCase(Locale.ROOT))) {
                return category;
            }
        }
        return candidate;
    }
}
