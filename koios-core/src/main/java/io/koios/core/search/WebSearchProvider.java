package io.koios.core.search;

import java.util.List;

public interface WebSearchProvider {
    String name();

    List<SearchResult> search(String query, int maxResults) throws WebSearchException;
}
