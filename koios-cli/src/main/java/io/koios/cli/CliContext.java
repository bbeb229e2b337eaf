package io.koios.cli;

import io.koios.core.config.ConfigService;
import io.koios.core.graph.DecisionGraphFactory;
import io.koios.core.history.ChatHistoryStore;
import io.koios.core.retrieval.DocumentIngestor;
import io.koios.core.retrieval.SqliteDocumentIndex;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    DecisionGraphFactory graphs,
    ChatHistoryStore history,
    SqliteDocumentIndex documents,
    DocumentIngestor ingestor,
    GatewayRunner gatewayRunner
) {
    public CliContext(
        ConfigService configService,
        Path configPath,
        DecisionGraphFactory graphs,
        ChatHistoryStore history,
        SqliteDocumentIndex documents,
        DocumentIngestor ingestor
    ) {
        this(configService, configPath, graphs, history, documents, ingestor, port -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
