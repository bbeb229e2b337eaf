package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Chat history persistence. {@code backend} is {@code sqlite} or {@code memory}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryConfig(String backend, String dbPath, int maxMessagesPerUser) {

    public static HistoryConfig defaults() {
        return new HistoryConfig("sqlite", "~/.koios/data/chat_history.db", 500);
    }

    public HistoryConfig withBackend(String backend) {
        return new HistoryConfig(backend, dbPath, maxMessagesPerUser);
    }

    public HistoryConfig withDbPath(String dbPath) {
        return new HistoryConfig(backend, dbPath, maxMessagesPerUser);
    }

    public HistoryConfig withMaxMessagesPerUser(int maxMessagesPerUser) {
        return new HistoryConfig(backend, dbPath, maxMessagesPerUser);
    }
}
