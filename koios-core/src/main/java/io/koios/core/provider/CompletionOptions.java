package io.koios.core.provider;

import java.util.Objects;

public record CompletionOptions(double temperature, ResponseFormat responseFormat) {

    public CompletionOptions {
        Objects.requireNonNull(responseFormat, "responseFormat must not be null");
        temperature = Math.max(0.0, Math.min(2.0, temperature));
    }

    public static CompletionOptions text(double temperature) {
        return new CompletionOptions(temperature, ResponseFormat.TEXT);
    }

    /**
     * Deterministic JSON-constrained generation, used for routing and query transformation.
     */
    public static CompletionOptions json() {
        return new CompletionOptions(0.0, ResponseFormat.JSON);
    }
}
