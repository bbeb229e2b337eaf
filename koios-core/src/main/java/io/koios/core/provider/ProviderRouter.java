package io.koios.core.provider;

import java.util.Locale;

/**
 * Picks the provider that serves a model. An explicit provider name wins;
 * otherwise hosted model families go to their vendor and everything else is
 * served by the local OpenAI-compatible endpoint.
 */
public final class ProviderRouter {
    public static final String LOCAL = "local";

    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.find(preferredProvider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + preferredProvider));
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("claude") || normalizedModel.startsWith("anthropic/")) {
            return registry.find("anthropic")
                .orElseThrow(() -> new IllegalArgumentException("Provider anthropic is not registered"));
        }
        if (normalizedModel.startsWith("gpt") || normalizedModel.startsWith("openai/")) {
            return registry.find("openai")
                .orElseThrow(() -> new IllegalArgumentException("Provider openai is not registered"));
        }

        return registry.find(LOCAL)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + LOCAL + " is not registered"));
    }
}
