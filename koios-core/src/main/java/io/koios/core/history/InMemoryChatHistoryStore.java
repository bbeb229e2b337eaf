package io.koios.core.history;

import io.koios.core.model.ConversationTurn;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local history with the same eviction rules as the SQLite store.
 * Each user's log is guarded by its own monitor, so users never wait on each other.
 */
public final class InMemoryChatHistoryStore implements ChatHistoryStore {
    private final ConcurrentMap<String, Deque<ConversationTurn>> messages = new ConcurrentHashMap<>();
    private final int maxMessagesPerUser;

    public InMemoryChatHistoryStore(int maxMessagesPerUser) {
        if (maxMessagesPerUser <= 0) {
            throw new IllegalArgumentException("maxMessagesPerUser must be positive");
        }
        this.maxMessagesPerUser = maxMessagesPerUser;
    }

    @Override
    public List<ConversationTurn> getHistory(String userId) {
        Deque<ConversationTurn> log = messages.get(requireUser(userId));
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    @Override
    public void addMessages(String userId, List<ConversationTurn> turns) {
        requireUser(userId);
        if (turns == null || turns.isEmpty()) {
            return;
        }
        Deque<ConversationTurn> log = messages.computeIfAbsent(userId, key -> new ArrayDeque<>());
        synchronized (log) {
            log.addAll(turns);
            while (log.size() > maxMessagesPerUser) {
                log.removeFirst();
            }
        }
    }

    @Override
    public int clearHistory(String userId) {
        Deque<ConversationTurn> log = messages.get(requireUser(userId));
        if (log == null) {
            return 0;
        }
        // the emptied deque stays mapped so a concurrent append never lands in a detached log
        synchronized (log) {
            int removed = log.size();
            log.clear();
            return removed;
        }
    }

    @Override
    public int messageCount(String userId) {
        Deque<ConversationTurn> log = messages.get(requireUser(userId));
        if (log == null) {
            return 0;
        }
        synchronized (log) {
            return log.size();
        }
    }

    @Override
    public List<String> listUsers() {
        List<String> users = new ArrayList<>();
        for (Map.Entry<String, Deque<ConversationTurn>> entry : messages.entrySet()) {
            Deque<ConversationTurn> log = entry.getValue();
            synchronized (log) {
                if (!log.isEmpty()) {
                    users.add(entry.getKey());
                }
            }
        }
        users.sort(null);
        return users;
    }

    @Override
    public int maxMessagesPerUser() {
        return maxMessagesPerUser;
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId;
    }
}
