package io.koios.core.search;

import io.koios.core.toon.ToonEncoder;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Web path of the retrieval orchestrator. Never throws for provider problems:
 * the result is always some context text for the generate stage.
 */
public final class WebSearchService {
    private static final Logger LOG = LoggerFactory.getLogger(WebSearchService.class);

    private final WebSearchProvider primary;
    private final FallbackSummaryProvider fallback;
    private final WebSearchRateLimiter rateLimiter;
    private final ToonEncoder toon;
    private final int maxResults;

    public WebSearchService(
        WebSearchProvider primary,
        FallbackSummaryProvider fallback,
        WebSearchRateLimiter rateLimiter,
        ToonEncoder toon,
        int maxResults
    ) {
        this.primary = primary;
        this.fallback = fallback;
        this.rateLimiter = rateLimiter;
        this.toon = toon;
        this.maxResults = Math.max(1, maxResults);
    }

    /**
     * Searches the web for {@code query}.
     *
     * @throws InterruptedException if the caller is interrupted while waiting for its rate slot
     */
    public String search(String query) throws InterruptedException {
        Exception primaryFailure;
        try {
            rateLimiter.acquire();
            List<SearchResult> results = primary.search(query, maxResults);
            LOG.debug("{} returned {} results for '{}'", primary.name(), results.size(), query);
            return toon.encode(Map.of("results", results));
        } catch (WebSearchException | RuntimeException e) {
            primaryFailure = e;
        }

        LOG.warn("{} search failed or rate limited: {}", primary.name(), primaryFailure.getMessage());
        LOG.info("Falling back to {}...", fallback.name());
        try {
            return fallback.summarize(query);
        } catch (WebSearchException | RuntimeException fallbackFailure) {
            LOG.warn("{} fallback failed: {}", fallback.name(), fallbackFailure.getMessage());
            return "Search failed: " + primaryFailure.getMessage() + ". Fallback failed: " + fallbackFailure.getMessage();
        }
    }
}
