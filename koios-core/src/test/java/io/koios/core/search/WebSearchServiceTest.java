package io.koios.core.search;

import static org.assertj.core.api.Assertions.assertThat;

import io.koios.core.toon.ToonEncoder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

class WebSearchServiceTest {

    @Test
    void shouldEncodeResultsAsToon() throws Exception {
        StubFallback fallback = new StubFallback("unused", null);
        WebSearchService service = service(
            new StubSearch(List.of(
                new SearchResult("JDK 25 released", "Oracle ships JDK 25", "https://openjdk.org/projects/jdk/25/")
            ), null),
            fallback
        );

        String context = service.search("latest jdk");

        assertThat(context).isEqualTo(String.join("\n",
            "results[1]{title,snippet,url}:",
            "  JDK 25 released,Oracle ships JDK 25,\"https://openjdk.org/projects/jdk/25/\""
        ));
        assertThat(fallback.queries).isEmpty();
    }

    @Test
    void shouldUseFallbackWhenPrimaryIsRateLimited() throws Exception {
        StubFallback fallback = new StubFallback("Page: Python\nSummary: Python 3.13 ...", null);
        WebSearchService service = service(
            new StubSearch(List.of(), new RateLimitedException("HTTP 202")),
            fallback
        );

        String context = service.search("latest python release");

        assertThat(context).isEqualTo("Page: Python\nSummary: Python 3.13 ...");
        assertThat(fallback.queries).containsExactly("latest python release");
    }

    @Test
    void shouldReportBothFailures() throws Exception {
        WebSearchService service = service(
            new StubSearch(List.of(), new WebSearchException("connect timed out")),
            new StubFallback(null, new WebSearchException("Wikipedia HTTP 503"))
        );

        String context = service.search("anything");

        assertThat(context).isEqualTo("Search failed: connect timed out. Fallback failed: Wikipedia HTTP 503");
    }

    @Test
    void shouldPassConfiguredResultLimit() throws Exception {
        StubSearch search = new StubSearch(List.of(), null);
        WebSearchService service = new WebSearchService(
            search,
            new StubFallback("", null),
            new WebSearchRateLimiter(Duration.ZERO),
            new ToonEncoder(),
            3
        );

        assertThat(service.search("q")).isEqualTo("results[0]:");
        assertThat(search.limits).containsExactly(3);
    }

    @Test
    void shouldFallBackWhenPrimaryFailsUnexpectedly() throws Exception {
        StubFallback fallback = new StubFallback("Page: Kotlin\nSummary: Kotlin 2.1 ...", null);
        WebSearchService service = service(
            new StubSearch(List.of(), new IllegalStateException("unexpected markup")),
            fallback
        );

        String context = service.search("latest kotlin release");

        assertThat(context).isEqualTo("Page: Kotlin\nSummary: Kotlin 2.1 ...");
        assertThat(fallback.queries).containsExactly("latest kotlin release");
    }

    @Test
    void shouldReportUnexpectedFallbackFailure() throws Exception {
        WebSearchService service = service(
            new StubSearch(List.of(), new RateLimitedException("HTTP 202")),
            new StubFallback(null, new IllegalArgumentException("bad extract"))
        );

        String context = service.search("anything");

        assertThat(context).isEqualTo("Search failed: HTTP 202. Fallback failed: bad extract");
    }

    @Test
    void shouldKeepDuckDuckGoResultWithMalformedRedirect() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody("""
                <html><body>
                  <div class="result">
                    <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fx.org%2F100%">Percent page</a>
                    <a class="result__snippet">Half an escape</a>
                  </div>
                </body></html>
                """));
            StubFallback fallback = new StubFallback("unused", null);
            WebSearchService service = service(
                new DuckDuckGoSearchProvider(server.url("/html/").toString()),
                fallback
            );

            String context = service.search("percent");

            assertThat(context).startsWith("results[1]{title,snippet,url}:");
            assertThat(context).contains("Percent page,Half an escape,");
            assertThat(context).contains("uddg=https%3A%2F%2Fx.org%2F100%");
            assertThat(fallback.queries).isEmpty();
        }
    }

    @Test
    void shouldSpaceBackToBackSearchesByMinimumInterval() throws Exception {
        StubSearch search = new StubSearch(List.of(), null);
        WebSearchService service = new WebSearchService(
            search,
            new StubFallback("", null),
            new WebSearchRateLimiter(Duration.ofMillis(100)),
            new ToonEncoder(),
            3
        );

        service.search("first");
        service.search("second");

        assertThat(search.callNanos).hasSize(2);
        long gapMillis = TimeUnit.NANOSECONDS.toMillis(search.callNanos.get(1) - search.callNanos.get(0));
        assertThat(gapMillis).isGreaterThanOrEqualTo(90);
    }

    private static WebSearchService service(WebSearchProvider primary, FallbackSummaryProvider fallback) {
        return new WebSearchService(primary, fallback, new WebSearchRateLimiter(Duration.ZERO), new ToonEncoder(), 3);
    }

    private static WebSearchException rethrow(Exception failure) {
        if (failure instanceof WebSearchException checked) {
            return checked;
        }
        throw (RuntimeException) failure;
    }

    private static final class StubSearch implements WebSearchProvider {
        private final List<SearchResult> results;
        private final Exception failure;
        private final List<Integer> limits = new ArrayList<>();
        private final List<Long> callNanos = new ArrayList<>();

        StubSearch(List<SearchResult> results, Exception failure) {
            this.results = results;
            this.failure = failure;
        }

        @Override
        public String name() {
            return "stub-search";
        }

        @Override
        public List<SearchResult> search(String query, int maxResults) throws WebSearchException {
            callNanos.add(System.nanoTime());
            limits.add(maxResults);
            if (failure != null) {
                throw rethrow(failure);
            }
            return results;
        }
    }

    private static final class StubFallback implements FallbackSummaryProvider {
        private final String summary;
        private final Exception failure;
        private final List<String> queries = new ArrayList<>();

        StubFallback(String summary, Exception failure) {
            this.summary = summary;
            this.failure = failure;
        }

        @Override
        public String name() {
            return "stub-wiki";
        }

        @Override
        public String summarize(String query) throws WebSearchException {
            queries.add(query);
            if (failure != null) {
                throw rethrow(failure);
            }
            return summary;
        }
    }
}
