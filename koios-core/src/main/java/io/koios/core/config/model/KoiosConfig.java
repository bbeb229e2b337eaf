package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KoiosConfig(
    AgentDefaults agent,
    ProvidersConfig providers,
    RetrievalConfig retrieval,
    WebSearchConfig webSearch,
    HistoryConfig history,
    GatewayConfig gateway
) {

    public static KoiosConfig defaults() {
        return new KoiosConfig(
            AgentDefaults.defaults(),
            ProvidersConfig.defaults(),
            RetrievalConfig.defaults(),
            WebSearchConfig.defaults(),
            HistoryConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    public KoiosConfig withWebSearch(WebSearchConfig webSearch) {
        return new KoiosConfig(agent, providers, retrieval, webSearch, history, gateway);
    }

    public KoiosConfig withHistory(HistoryConfig history) {
        return new KoiosConfig(agent, providers, retrieval, webSearch, history, gateway);
    }

    public KoiosConfig withGateway(GatewayConfig gateway) {
        return new KoiosConfig(agent, providers, retrieval, webSearch, history, gateway);
    }

    public KoiosConfig withProviders(ProvidersConfig providers) {
        return new KoiosConfig(agent, providers, retrieval, webSearch, history, gateway);
    }
}
