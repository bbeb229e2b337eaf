package io.koios.core.graph;

public enum GraphNode {
    ROUTE,
    DOC_SEARCH,
    TRANSFORM_QUERY,
    WEB_SEARCH,
    GENERATE
}
