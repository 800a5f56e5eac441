package com.naagi.ragflow.model;

/**
 * One prior message of the conversation.
 */
public record ConversationTurn(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public ConversationTurn {
        if (role == null) {
            throw new IllegalArgumentException("Turn role is required");
        }
        content = content == null ? "" : content;
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }
}
