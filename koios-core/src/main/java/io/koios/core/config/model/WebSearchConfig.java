package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSearchConfig(
    boolean enableInternetSearch,
    String provider,
    String braveApiKey,
    int maxResults,
    long minIntervalMillis,
    String wikipediaEndpoint
) {

    public static WebSearchConfig defaults() {
        return new WebSearchConfig(
            false,
            "duckduckgo",
            "",
            3,
            1000,
            "https://en.wikipedia.org/w/api.php"
        );
    }

    public WebSearchConfig withEnableInternetSearch(boolean enabled) {
        return new WebSearchConfig(enabled, provider, braveApiKey, maxResults, minIntervalMillis, wikipediaEndpoint);
    }
}
