package io.koios.core.graph;

import io.koios.core.provider.CompletionException;
import io.koios.core.query.QueryReformulator;
import io.koios.core.query.QueryRouter;
import io.koios.core.query.RouteDecision;
import io.koios.core.retrieval.DocumentSearchService;
import io.koios.core.search.WebSearchService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed four-stage workflow: route, optionally retrieve from documents and/or
 * the web, then generate. One instance serves one request.
 *
 * <p>Retrieval problems degrade to empty or explanatory context. A
 * {@link CompletionException} from any stage ends the invocation.
 */
public final class DecisionGraph {
    private static final Logger LOG = LoggerFactory.getLogger(DecisionGraph.class);

    private final GraphSettings settings;
    private final QueryRouter router;
    private final QueryReformulator reformulator;
    private final DocumentSearchService documentSearch;
    private final WebSearchService webSearch;
    private final AnswerGenerator generator;

    DecisionGraph(
        GraphSettings settings,
        QueryRouter router,
        QueryReformulator reformulator,
        DocumentSearchService documentSearch,
        WebSearchService webSearch,
        AnswerGenerator generator
    ) {
        this.settings = settings;
        this.router = router;
        this.reformulator = reformulator;
        this.documentSearch = documentSearch;
        this.webSearch = webSearch;
        this.generator = generator;
    }

    public GraphSettings settings() {
        return settings;
    }

    public GraphResult invoke(GraphInput input) {
        GraphState state = GraphState.initial(input);
        List<GraphNode> path = new ArrayList<>();
        Set<GraphNode> visited = EnumSet.noneOf(GraphNode.class);

        GraphNode node = GraphNode.ROUTE;
        while (node != null) {
            if (!visited.add(node)) {
                throw new IllegalStateException("Stage " + node + " visited twice");
            }
            checkCancelled(node);
            path.add(node);
            state = state.apply(run(node, state));
            node = next(node, state, settings.enableInternetSearch());
        }

        return new GraphResult(state.generation(), state.context(), state.searchQuery(), state.route(), path);
    }

    private StateUpdate run(GraphNode node, GraphState state) {
        return switch (node) {
            case ROUTE -> route(state);
            case DOC_SEARCH -> searchDocuments(state);
            case TRANSFORM_QUERY -> transformQuery(state);
            case WEB_SEARCH -> searchWeb(state);
            case GENERATE -> generate(state);
        };
    }

    /**
     * Successor of {@code node}, or {@code null} after the terminal stage.
     */
    static GraphNode next(GraphNode node, GraphState state, boolean internetEnabled) {
        return switch (node) {
            case ROUTE -> switch (state.route()) {
                case DOC_SEARCH -> GraphNode.DOC_SEARCH;
                case WEB_SEARCH -> GraphNode.TRANSFORM_QUERY;
                case GENERATE -> GraphNode.GENERATE;
            };
            case DOC_SEARCH -> !state.hasContext() && internetEnabled ? GraphNode.TRANSFORM_QUERY : GraphNode.GENERATE;
            case TRANSFORM_QUERY -> GraphNode.WEB_SEARCH;
            case WEB_SEARCH -> GraphNode.GENERATE;
            case GENERATE -> null;
        };
    }

    private StateUpdate route(GraphState state) {
        LOG.info("Step: Routing question");
        RouteDecision decision = router.route(state.question());
        if (decision == RouteDecision.WEB_SEARCH && !settings.enableInternetSearch()) {
            LOG.info("Internet search is disabled, using {} instead of {}",
                RouteDecision.DOC_SEARCH.wireValue(), decision.wireValue());
            decision = RouteDecision.DOC_SEARCH;
        }
        LOG.info("Step: Routing to {}", decision.wireValue());
        return StateUpdate.routed(decision);
    }

    private StateUpdate searchDocuments(GraphState state) {
        LOG.info("Step: Searching documents");
        try {
            DocumentSearchService.Outcome outcome = documentSearch.search(state.question(), state.history());
            if (outcome.passages() == 0) {
                LOG.info("Step: No documents matched");
            }
            return StateUpdate.retrieved(outcome.query(), combine(state.context(), outcome.context()));
        } catch (IOException e) {
            LOG.warn("Document search failed, continuing without documents: {}", e.getMessage());
            return StateUpdate.retrieved(state.question(), state.context());
        }
    }

    private StateUpdate transformQuery(GraphState state) {
        LOG.info("Step: Optimizing query for web search");
        String query = reformulator.webQuery(state.question());
        LOG.info("Step: Web search query is '{}'", query);
        return StateUpdate.transformed(query);
    }

    private StateUpdate searchWeb(GraphState state) {
        LOG.info("Step: Searching the web for '{}'", state.searchQuery());
        try {
            return StateUpdate.withContext(combine(state.context(), webSearch.search(state.searchQuery())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphCancelledException("Cancelled while waiting for web search", e);
        }
    }

    private StateUpdate generate(GraphState state) {
        LOG.info("Step: Generating final response");
        return StateUpdate.generated(generator.generate(state.question(), state.context(), state.history()));
    }

    // caller-supplied context stays ahead of anything retrieved
    static String combine(String existing, String found) {
        if (existing == null || existing.isBlank()) {
            return found == null ? "" : found;
        }
        if (found == null || found.isBlank()) {
            return existing;
        }
        return existing + "\n\n" + found;
    }

    private void checkCancelled(GraphNode node) {
        if (Thread.currentThread().isInterrupted()) {
            throw new GraphCancelledException("Cancelled before stage " + node);
        }
    }
}
