package io.koios.core.graph;

import io.koios.core.model.ConversationTurn;
import java.util.List;

public record GraphInput(String question, List<ConversationTurn> history, String context) {
    public GraphInput {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        history = history == null ? List.of() : List.copyOf(history);
        context = context == null ? "" : context;
    }

    public static GraphInput of(String question, List<ConversationTurn> history) {
        return new GraphInput(question, history, "");
    }
}
