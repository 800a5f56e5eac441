package com.naagi.ragflow.dto;

import com.naagi.ragflow.model.ConversationTurn;

import java.util.List;
import java.util.Locale;

public record AskRequest(
        String userId,
        String sessionId,   // optional, defaults to userId
        String question,
        List<String> categories,
        List<HistoryTurn> history
) {
    public record HistoryTurn(String role, String content) {}

    /**
     * Request-shape checks only; content rules such as the minimum question length are
     * enforced by the workflow and reported in its output.
     */
    public void validate() {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (question == null) {
            throw new IllegalArgumentException("question is required");
        }
        if (history != null) {
            for (HistoryTurn turn : history) {
                if (turn == null || turn.role() == null) {
                    throw new IllegalArgumentException("history entries need a role");
                }
                parseRole(turn.role());
            }
        }
    }

    public List<String> getCategoriesOrEmpty() {
        return categories != null ? categories : List.of();
    }

    public List<ConversationTurn> toConversation() {
        if (history == null) {
            return List.of();
        }
        return history.stream()
                .map(turn -> new ConversationTurn(parseRole(turn.role()), turn.content()))
                .toList();
    }

    private static ConversationTurn.Role parseRole(String role) {
        try {
            return ConversationTurn.Role.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown history role: " + role);
        }
    }
}
