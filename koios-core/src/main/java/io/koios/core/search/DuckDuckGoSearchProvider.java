package io.koios.core.search;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Keyless search through the DuckDuckGo HTML endpoint. DuckDuckGo answers a
 * throttled client with HTTP 202 and an anomaly page instead of results.
 */
public final class DuckDuckGoSearchProvider implements WebSearchProvider {
    public static final String DEFAULT_ENDPOINT = "https://html.duckduckgo.com/html/";
    private static final String MODERATE_SAFE_SEARCH = "-1";

    private final HttpUrl endpoint;
    private final OkHttpClient client;

    public DuckDuckGoSearchProvider() {
        this(DEFAULT_ENDPOINT);
    }

    public DuckDuckGoSearchProvider(String endpoint) {
        this.endpoint = HttpUrl.get(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(20))
            .build();
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) throws WebSearchException {
        if (query == null || query.isBlank()) {
            throw new WebSearchException("query is required");
        }

        Request request = new Request.Builder()
            .url(endpoint)
            .post(new FormBody.Builder()
                .add("q", query)
                .add("kp", MODERATE_SAFE_SEARCH)
                .build())
            .header("User-Agent", "Mozilla/5.0 (compatible; koios/0.1)")
            .header("Accept", "text/html")
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 429 || response.code() == 202) {
                throw new RateLimitedException("DuckDuckGo rate limited the request (HTTP " + response.code() + ")");
            }
            if (!response.isSuccessful()) {
                throw new WebSearchException("DuckDuckGo search HTTP " + response.code());
            }
            String body = response.body() == null ? "" : response.body().string();
            return parse(body, Math.max(1, maxResults));
        } catch (IOException e) {
            throw new WebSearchException("DuckDuckGo search failed: " + e.getMessage(), e);
        }
    }

    List<SearchResult> parse(String html, int maxResults) {
        Document document = Jsoup.parse(html);
        List<SearchResult> results = new ArrayList<>();
        for (Element result : document.select("div.result")) {
            if (result.hasClass("result--ad")) {
                continue;
            }
            Element link = result.selectFirst("a.result__a");
            if (link == null) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            results.add(new SearchResult(
                link.text(),
                snippet == null ? "" : snippet.text(),
                unwrapRedirect(link.attr("href"))
            ));
            if (results.size() >= maxResults) {
                break;
            }
        }
        return results;
    }

    private String unwrapRedirect(String href) {
        int marker = href.indexOf("uddg=");
        if (marker < 0) {
            return href;
        }
        String encoded = href.substring(marker + 5);
        int end = encoded.indexOf('&');
        if (end >= 0) {
            encoded = encoded.substring(0, end);
        }
        try {
            return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escape, keep the link as served
            return href;
        }
    }
}
