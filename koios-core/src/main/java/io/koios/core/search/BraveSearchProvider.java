package io.koios.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class BraveSearchProvider implements WebSearchProvider {
    public static final String DEFAULT_ENDPOINT = "https://api.search.brave.com/res/v1/web/search";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String endpoint;

    public BraveSearchProvider(String apiKey) {
        this(apiKey, DEFAULT_ENDPOINT);
    }

    public BraveSearchProvider(String apiKey, String endpoint) {
        this.client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.mapper = new ObjectMapper();
        this.apiKey = apiKey == null ? "" : apiKey;
        this.endpoint = endpoint;
    }

    @Override
    public String name() {
        return "brave";
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) throws WebSearchException {
        if (query == null || query.isBlank()) {
            throw new WebSearchException("query is required");
        }
        if (apiKey.isBlank()) {
            throw new WebSearchException("BRAVE_API_KEY not configured");
        }

        int capped = Math.min(Math.max(maxResults, 1), 10);
        URI uri = URI.create(endpoint + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&count=" + capped);

        HttpRequest request = HttpRequest.newBuilder(uri)
            .GET()
            .timeout(Duration.ofSeconds(20))
            .header("Accept", "application/json")
            .header("X-Subscription-Token", apiKey)
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WebSearchException("Brave search failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebSearchException("Brave search interrupted", e);
        }

        if (response.statusCode() == 429) {
            throw new RateLimitedException("Brave search rate limited");
        }
        if (response.statusCode() >= 400) {
            throw new WebSearchException("Brave search HTTP " + response.statusCode());
        }
        return parse(response.body(), capped);
    }

    private List<SearchResult> parse(String body, int maxResults) throws WebSearchException {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "{}" : body);
        } catch (IOException e) {
            throw new WebSearchException("Brave search returned invalid JSON", e);
        }

        List<SearchResult> results = new ArrayList<>();
        for (JsonNode result : root.path("web").path("results")) {
            results.add(new SearchResult(
                result.path("title").asText(""),
                result.path("description").asText(""),
                result.path("url").asText("")
            ));
            if (results.size() >= maxResults) {
                break;
            }
        }
        return results;
    }
}
