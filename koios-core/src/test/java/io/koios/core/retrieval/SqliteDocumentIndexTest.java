package io.koios.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteDocumentIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnTopKBySimilarity() throws Exception {
        SqliteDocumentIndex index = new SqliteDocumentIndex(
            tempDir.resolve("documents.db"),
            new KeywordEmbeddingClient("leave", "payroll", "security")
        );
        index.addChunks("handbook.pdf", List.of(
            "Annual leave is 25 days. Unused leave carries over.",
            "Payroll runs on the last working day."
        ));
        index.addChunks("policy.txt", List.of("Security badges must be worn at all times."));

        List<RetrievedPassage> passages = index.retrieve("How much leave do I get?", 2);

        assertThat(passages).hasSize(2);
        assertThat(passages.get(0)).isEqualTo(
            new RetrievedPassage("handbook.pdf", "Annual leave is 25 days. Unused leave carries over.")
        );
    }

    @Test
    void shouldReplaceChunksOfSameSource() throws Exception {
        SqliteDocumentIndex index = new SqliteDocumentIndex(tempDir.resolve("documents.db"), new KeywordEmbeddingClient("a"));

        index.addChunks("notes.txt", List.of("a one", "a two", "a three"));
        index.addChunks("notes.txt", List.of("a replaced"));
        index.addChunks("other.txt", List.of("a other"));

        assertThat(index.chunkCount()).isEqualTo(2);
        assertThat(index.listSources()).containsExactly("notes.txt", "other.txt");
    }

    @Test
    void shouldReturnNothingForBlankQueryOrEmptyIndex() throws Exception {
        KeywordEmbeddingClient embeddings = new KeywordEmbeddingClient("a");
        SqliteDocumentIndex index = new SqliteDocumentIndex(tempDir.resolve("documents.db"), embeddings);

        assertThat(index.retrieve(" ", 3)).isEmpty();
        assertThat(index.retrieve("anything", 0)).isEmpty();
        assertThat(embeddings.embedded()).isEmpty();
        assertThat(index.retrieve("anything", 3)).isEmpty();
    }

    @Test
    void shouldClearAllChunks() throws Exception {
        SqliteDocumentIndex index = new SqliteDocumentIndex(tempDir.resolve("nested/dir/documents.db"), new KeywordEmbeddingClient("a"));
        index.addChunks("a.txt", List.of("a", "aa"));

        assertThat(index.clear()).isEqualTo(2);
        assertThat(index.chunkCount()).isZero();
        assertThat(index.listSources()).isEmpty();
    }

    @Test
    void shouldComputeCosineSimilarity() {
        assertThat(SqliteDocumentIndex.cosine(new double[] {1, 0}, new double[] {1, 0})).isEqualTo(1.0);
        assertThat(SqliteDocumentIndex.cosine(new double[] {1, 0}, new double[] {0, 1})).isZero();
        assertThat(SqliteDocumentIndex.cosine(new double[] {0, 0}, new double[] {1, 1})).isZero();
        assertThat(SqliteDocumentIndex.cosine(new double[] {1}, new double[] {1, 1})).isZero();
    }
}
