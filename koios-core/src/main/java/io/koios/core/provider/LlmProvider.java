package io.koios.core.provider;

import io.koios.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, CompletionOptions options);
}
