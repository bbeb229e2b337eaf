package io.koios.core.graph;

import java.util.Objects;

/**
 * Per-request graph parameters.
 */
public record GraphSettings(String model, double temperature, boolean enableInternetSearch) {
    public GraphSettings {
        Objects.requireNonNull(model, "model must not be null");
        if (model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        temperature = Math.max(0.0, Math.min(2.0, temperature));
    }
}
