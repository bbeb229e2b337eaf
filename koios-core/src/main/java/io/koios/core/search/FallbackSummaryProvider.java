package io.koios.core.search;

/**
 * Slower lookup used when the primary web search is rate limited or down.
 */
public interface FallbackSummaryProvider {
    String name();

    String summarize(String query) throws WebSearchException;
}
