package io.koios.core.history;

import io.koios.core.model.ConversationTurn;
import java.io.IOException;
import java.util.List;

/**
 * Bounded per-user message log. Each user keeps at most a configured number of
 * messages; appending past the cap drops that user's oldest messages first.
 */
public interface ChatHistoryStore {
    /**
     * The user's retained messages, oldest first.
     */
    List<ConversationTurn> getHistory(String userId) throws IOException;

    /**
     * Appends all messages atomically: either every message is stored or none is.
     */
    void addMessages(String userId, List<ConversationTurn> messages) throws IOException;

    int clearHistory(String userId) throws IOException;

    int messageCount(String userId) throws IOException;

    List<String> listUsers() throws IOException;

    int maxMessagesPerUser();
}
