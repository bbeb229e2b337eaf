package io.koios.core.graph;

import io.koios.core.model.ConversationTurn;
import io.koios.core.query.RouteDecision;
import java.util.List;

/**
 * Working state of one graph invocation. Stages never mutate it; they return a
 * {@link StateUpdate} holding only the fields they change.
 */
record GraphState(
    String question,
    List<ConversationTurn> history,
    String context,
    String searchQuery,
    String generation,
    RouteDecision route
) {
    static GraphState initial(GraphInput input) {
        return new GraphState(input.question(), input.history(), input.context(), "", "", null);
    }

    GraphState apply(StateUpdate update) {
        return new GraphState(
            question,
            history,
            update.context() == null ? context : update.context(),
            update.searchQuery() == null ? searchQuery : update.searchQuery(),
            update.generation() == null ? generation : update.generation(),
            update.route() == null ? route : update.route()
        );
    }

    boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
