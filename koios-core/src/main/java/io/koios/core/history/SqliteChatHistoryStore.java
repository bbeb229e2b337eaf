package io.koios.core.history;

import io.koios.core.model.ConversationTurn;
import io.koios.core.model.MessageRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite-backed history. Writes for one user are serialized by a per-user lock
 * and insert plus eviction share one transaction, so the cap holds under
 * concurrent appends. Reads take no lock.
 */
public final class SqliteChatHistoryStore implements ChatHistoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteChatHistoryStore.class);
    // fixed width so that text order equals time order
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
        .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
        .withZone(ZoneOffset.UTC);

    private final String jdbcUrl;
    private final int maxMessagesPerUser;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public SqliteChatHistoryStore(Path dbPath, int maxMessagesPerUser) throws IOException {
        this(dbPath, maxMessagesPerUser, Clock.systemUTC());
    }

    public SqliteChatHistoryStore(Path dbPath, int maxMessagesPerUser, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        if (maxMessagesPerUser <= 0) {
            throw new IllegalArgumentException("maxMessagesPerUser must be positive");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.maxMessagesPerUser = maxMessagesPerUser;
        this.clock = clock;
        init();
        LOG.info("Chat history store initialized at {} (max {} messages per user)", dbPath, maxMessagesPerUser);
    }

    @Override
    public List<ConversationTurn> getHistory(String userId) throws IOException {
        requireUser(userId);
        String sql = """
            SELECT role, content FROM (
                SELECT id, role, content, created_at
                FROM chat_messages
                WHERE user_id = ?
                ORDER BY created_at DESC, id DESC
                LIMIT ?
            )
            ORDER BY created_at ASC, id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, userId);
            statement.setInt(2, maxMessagesPerUser);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ConversationTurn> turns = new ArrayList<>();
                while (resultSet.next()) {
                    turns.add(new ConversationTurn(
                        MessageRole.fromWire(resultSet.getString("role")),
                        resultSet.getString("content")
                    ));
                }
                return turns;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load chat history for " + userId, e);
        }
    }

    @Override
    public void addMessages(String userId, List<ConversationTurn> messages) throws IOException {
        requireUser(userId);
        if (messages == null || messages.isEmpty()) {
            return;
        }

        String insert = """
            INSERT INTO chat_messages (user_id, role, content, created_at)
            VALUES (?, ?, ?, ?)
            """;
        String evict = """
            DELETE FROM chat_messages
            WHERE id IN (
                SELECT id FROM chat_messages
                WHERE user_id = ?
                ORDER BY created_at DESC, id DESC
                LIMIT -1 OFFSET ?
            )
            """;

        ReentrantLock lock = userLocks.computeIfAbsent(userId, key -> new ReentrantLock());
        lock.lock();
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement insertStatement = connection.prepareStatement(insert);
                 PreparedStatement evictStatement = connection.prepareStatement(evict)) {
                String createdAt = TIMESTAMP.format(clock.instant());
                for (ConversationTurn message : messages) {
                    insertStatement.setString(1, userId);
                    insertStatement.setString(2, message.role().wireValue());
                    insertStatement.setString(3, message.content());
                    insertStatement.setString(4, createdAt);
                    insertStatement.addBatch();
                }
                insertStatement.executeBatch();

                evictStatement.setString(1, userId);
                evictStatement.setInt(2, maxMessagesPerUser);
                int evicted = evictStatement.executeUpdate();
                connection.commit();
                if (evicted > 0) {
                    LOG.debug("Evicted {} old messages for user {}", evicted, userId);
                }
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to add messages for " + userId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int clearHistory(String userId) throws IOException {
        requireUser(userId);
        ReentrantLock lock = userLocks.computeIfAbsent(userId, key -> new ReentrantLock());
        lock.lock();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM chat_messages WHERE user_id = ?")) {
            statement.setString(1, userId);
            int deleted = statement.executeUpdate();
            LOG.info("Cleared {} messages for user {}", deleted, userId);
            return deleted;
        } catch (SQLException e) {
            throw new IOException("Failed to clear chat history for " + userId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int messageCount(String userId) throws IOException {
        requireUser(userId);
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT COUNT(*) FROM chat_messages WHERE user_id = ?")) {
            statement.setString(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count messages for " + userId, e);
        }
    }

    @Override
    public List<String> listUsers() throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT DISTINCT user_id FROM chat_messages ORDER BY user_id ASC");
             ResultSet resultSet = statement.executeQuery()) {
            List<String> users = new ArrayList<>();
            while (resultSet.next()) {
                users.add(resultSet.getString(1));
            }
            return users;
        } catch (SQLException e) {
            throw new IOException("Failed to list chat history users", e);
        }
    }

    @Override
    public int maxMessagesPerUser() {
        return maxMessagesPerUser;
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS chat_messages (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                role TEXT NOT NULL,
                content TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_chat_messages_user_created
            ON chat_messages(user_id, created_at, id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite chat history store", e);
        }
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }
}
