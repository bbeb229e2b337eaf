package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    String dbPath,
    String embeddingModel,
    int topK,
    int chunkSize,
    int chunkOverlap
) {

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(
            "~/.koios/data/documents.db",
            "text-embedding-nomic-embed-text-v1.5",
            3,
            1000,
            200
        );
    }
}
