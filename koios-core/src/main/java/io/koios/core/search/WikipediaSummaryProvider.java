package io.koios.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Summaries of the best matching Wikipedia pages via the MediaWiki API.
 */
public final class WikipediaSummaryProvider implements FallbackSummaryProvider {
    public static final String DEFAULT_ENDPOINT = "https://en.wikipedia.org/w/api.php";
    public static final String NO_RESULT = "No good Wikipedia Search Result was found";

    private final HttpUrl endpoint;
    private final int topResults;
    private final int maxChars;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public WikipediaSummaryProvider() {
        this(DEFAULT_ENDPOINT, 3, 4000);
    }

    public WikipediaSummaryProvider(String endpoint, int topResults, int maxChars) {
        this.endpoint = HttpUrl.get(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.topResults = Math.max(1, topResults);
        this.maxChars = Math.max(1, maxChars);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "wikipedia";
    }

    @Override
    public String summarize(String query) throws WebSearchException {
        if (query == null || query.isBlank()) {
            throw new WebSearchException("query is required");
        }

        List<String> titles = searchTitles(query);
        List<String> blocks = new ArrayList<>();
        for (String title : titles) {
            String extract = extract(title);
            if (!extract.isBlank()) {
                blocks.add("Page: " + title + "\nSummary: " + extract);
            }
        }
        if (blocks.isEmpty()) {
            return NO_RESULT;
        }

        String joined = String.join("\n\n", blocks);
        return joined.length() > maxChars ? joined.substring(0, maxChars) : joined;
    }

    private List<String> searchTitles(String query) throws WebSearchException {
        HttpUrl url = endpoint.newBuilder()
            .addQueryParameter("action", "query")
            .addQueryParameter("list", "search")
            .addQueryParameter("srsearch", query)
            .addQueryParameter("srlimit", String.valueOf(topResults))
            .addQueryParameter("format", "json")
            .build();

        List<String> titles = new ArrayList<>();
        for (JsonNode hit : get(url).path("query").path("search")) {
            String title = hit.path("title").asText("");
            if (!title.isBlank()) {
                titles.add(title);
            }
        }
        return titles;
    }

    private String extract(String title) throws WebSearchException {
        HttpUrl url = endpoint.newBuilder()
            .addQueryParameter("action", "query")
            .addQueryParameter("prop", "extracts")
            .addQueryParameter("exintro", "1")
            .addQueryParameter("explaintext", "1")
            .addQueryParameter("redirects", "1")
            .addQueryParameter("titles", title)
            .addQueryParameter("format", "json")
            .build();

        for (JsonNode page : get(url).path("query").path("pages")) {
            String extract = page.path("extract").asText("");
            if (!extract.isBlank()) {
                return extract.trim();
            }
        }
        return "";
    }

    private JsonNode get(HttpUrl url) throws WebSearchException {
        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("User-Agent", "koios/0.1")
            .header("Accept", "application/json")
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new WebSearchException("Wikipedia HTTP " + response.code());
            }
            return mapper.readTree(response.body() == null ? "{}" : response.body().string());
        } catch (IOException e) {
            throw new WebSearchException("Wikipedia lookup failed: " + e.getMessage(), e);
        }
    }
}
