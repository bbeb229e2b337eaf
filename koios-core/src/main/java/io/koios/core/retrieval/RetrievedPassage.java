package io.koios.core.retrieval;

public record RetrievedPassage(String source, String content) {
    public RetrievedPassage {
        source = source == null ? "" : source;
        content = content == null ? "" : content;
    }
}
