package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig local,
    ProviderConfig openai,
    ProviderConfig anthropic
) {
    public static final String DEFAULT_LOCAL_API_BASE = "http://127.0.0.1:1234/v1";

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.local(DEFAULT_LOCAL_API_BASE),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }

    public ProvidersConfig withLocal(ProviderConfig local) {
        return new ProvidersConfig(local, openai, anthropic);
    }
}
