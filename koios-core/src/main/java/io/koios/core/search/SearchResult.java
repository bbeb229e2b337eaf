package io.koios.core.search;

public record SearchResult(String title, String snippet, String url) {
    public SearchResult {
        title = title == null ? "" : title;
        snippet = snippet == null ? "" : snippet;
        url = url == null ? "" : url;
    }
}
