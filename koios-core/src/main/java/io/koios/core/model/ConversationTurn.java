package io.koios.core.model;

import java.util.Objects;

/**
 * One message of a conversation. Only user and assistant turns are part of a
 * conversation; system instructions are never persisted.
 */
public record ConversationTurn(MessageRole role, String content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        if (role == MessageRole.SYSTEM) {
            throw new IllegalArgumentException("conversation turns must be user or assistant");
        }
        content = content == null ? "" : content;
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(MessageRole.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(MessageRole.ASSISTANT, content);
    }

    public ChatMessage toChatMessage() {
        return new ChatMessage(role, content);
    }
}
