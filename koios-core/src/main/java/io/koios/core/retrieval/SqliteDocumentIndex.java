package io.koios.core.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document chunks with their embeddings in SQLite, searched by brute-force
 * cosine similarity.
 */
public final class SqliteDocumentIndex implements DocumentRetriever {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteDocumentIndex.class);

    private final String jdbcUrl;
    private final EmbeddingClient embeddings;
    private final ObjectMapper mapper;

    public SqliteDocumentIndex(Path dbPath, EmbeddingClient embeddings) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.embeddings = embeddings;
        this.mapper = new ObjectMapper();
        init();
    }

    /**
     * Embeds and stores the chunks of one source, replacing any chunks previously stored for it.
     */
    public synchronized int addChunks(String source, List<String> chunks) throws IOException {
        if (chunks.isEmpty()) {
            return 0;
        }
        List<double[]> vectors = embeddings.embed(chunks);

        String delete = "DELETE FROM document_chunks WHERE source = ?";
        String insert = """
            INSERT INTO document_chunks (source, chunk_index, content, embedding_json)
            VALUES (?, ?, ?, ?)
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement deleteStatement = connection.prepareStatement(delete);
                 PreparedStatement insertStatement = connection.prepareStatement(insert)) {
                deleteStatement.setString(1, source);
                deleteStatement.executeUpdate();
                for (int i = 0; i < chunks.size(); i++) {
                    insertStatement.setString(1, source);
                    insertStatement.setInt(2, i);
                    insertStatement.setString(3, chunks.get(i));
                    insertStatement.setString(4, mapper.writeValueAsString(vectors.get(i)));
                    insertStatement.addBatch();
                }
                insertStatement.executeBatch();
                connection.commit();
            } catch (SQLException | IOException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to store chunks for " + source, e);
        }
        LOG.info("Indexed {} chunks from {}", chunks.size(), source);
        return chunks.size();
    }

    @Override
    public List<RetrievedPassage> retrieve(String query, int k) throws IOException {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        double[] queryVector = embeddings.embed(List.of(query)).get(0);

        String sql = "SELECT source, content, embedding_json FROM document_chunks";
        PriorityQueue<Scored> best = new PriorityQueue<>(Comparator.comparingDouble(Scored::score));
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                double[] vector = mapper.readValue(resultSet.getString("embedding_json"), double[].class);
                double score = cosine(queryVector, vector);
                best.add(new Scored(
                    new RetrievedPassage(resultSet.getString("source"), resultSet.getString("content")),
                    score
                ));
                if (best.size() > k) {
                    best.poll();
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to search document index", e);
        }

        List<Scored> ranked = new ArrayList<>(best);
        ranked.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<RetrievedPassage> passages = new ArrayList<>();
        for (Scored scored : ranked) {
            passages.add(scored.passage());
        }
        return passages;
    }

    public List<String> listSources() throws IOException {
        String sql = "SELECT DISTINCT source FROM document_chunks ORDER BY source ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<String> sources = new ArrayList<>();
            while (resultSet.next()) {
                sources.add(resultSet.getString(1));
            }
            return sources;
        } catch (SQLException e) {
            throw new IOException("Failed to list document sources", e);
        }
    }

    public int chunkCount() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM document_chunks")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new IOException("Failed to count document chunks", e);
        }
    }

    public synchronized int clear() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            int deleted = statement.executeUpdate("DELETE FROM document_chunks");
            LOG.info("Cleared {} chunks from document index", deleted);
            return deleted;
        } catch (SQLException e) {
            throw new IOException("Failed to clear document index", e);
        }
    }

    static double cosine(double[] a, double[] b) {
        if (a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS document_chunks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                source TEXT NOT NULL,
                chunk_index INTEGER NOT NULL,
                content TEXT NOT NULL,
                embedding_json TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_document_chunks_source
            ON document_chunks(source, chunk_index)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite document index", e);
        }
    }

    private record Scored(RetrievedPassage passage, double score) {
    }
}
