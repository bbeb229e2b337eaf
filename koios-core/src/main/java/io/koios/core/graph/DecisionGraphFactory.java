package io.koios.core.graph;

import io.koios.core.provider.CompletionService;
import io.koios.core.query.QueryReformulator;
import io.koios.core.query.QueryRouter;
import io.koios.core.retrieval.DocumentRetriever;
import io.koios.core.retrieval.DocumentSearchService;
import io.koios.core.search.WebSearchService;
import io.koios.core.toon.ToonEncoder;

/**
 * Holds the process-wide collaborators and binds a fresh graph to each
 * request's settings.
 */
public final class DecisionGraphFactory {
    private final CompletionService completions;
    private final DocumentRetriever retriever;
    private final WebSearchService webSearch;
    private final ToonEncoder toon;
    private final int topK;

    public DecisionGraphFactory(
        CompletionService completions,
        DocumentRetriever retriever,
        WebSearchService webSearch,
        ToonEncoder toon,
        int topK
    ) {
        this.completions = completions;
        this.retriever = retriever;
        this.webSearch = webSearch;
        this.toon = toon;
        this.topK = topK;
    }

    public DecisionGraph create(GraphSettings settings) {
        QueryReformulator reformulator = new QueryReformulator(completions, settings.model());
        return new DecisionGraph(
            settings,
            new QueryRouter(completions, settings.model()),
            reformulator,
            new DocumentSearchService(reformulator, retriever, toon, topK),
            webSearch,
            new AnswerGenerator(completions, settings.model(), settings.temperature())
        );
    }
}
