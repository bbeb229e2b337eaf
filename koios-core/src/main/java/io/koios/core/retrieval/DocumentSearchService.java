package io.koios.core.retrieval;

import io.koios.core.model.ConversationTurn;
import io.koios.core.query.QueryReformulator;
import io.koios.core.toon.ToonEncoder;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document path of the retrieval orchestrator: standalone rewrite, top-k lookup,
 * compact encoding. No passages means empty context.
 */
public final class DocumentSearchService {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentSearchService.class);

    private final QueryReformulator reformulator;
    private final DocumentRetriever retriever;
    private final ToonEncoder toon;
    private final int topK;

    public DocumentSearchService(QueryReformulator reformulator, DocumentRetriever retriever, ToonEncoder toon, int topK) {
        this.reformulator = reformulator;
        this.retriever = retriever;
        this.toon = toon;
        this.topK = Math.max(1, topK);
    }

    public Outcome search(String question, List<ConversationTurn> history) throws IOException {
        String query = reformulator.standalone(question, history);
        List<RetrievedPassage> passages = retriever.retrieve(query, topK);
        LOG.debug("Retrieved {} passages for '{}'", passages.size(), query);
        if (passages.isEmpty()) {
            return new Outcome(query, "", 0);
        }
        return new Outcome(query, toon.encode(Map.of("documents", passages)), passages.size());
    }

    public record Outcome(String query, String context, int passages) {
    }
}
