package io.koios.core.graph;

import io.koios.core.query.RouteDecision;
import java.util.List;

public record GraphResult(
    String generation,
    String context,
    String searchQuery,
    RouteDecision route,
    List<GraphNode> path
) {
    public GraphResult {
        generation = generation == null ? "" : generation;
        context = context == null ? "" : context;
        searchQuery = searchQuery == null ? "" : searchQuery;
        path = path == null ? List.of() : List.copyOf(path);
    }
}
