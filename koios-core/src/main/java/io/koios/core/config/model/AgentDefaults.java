package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Generation defaults. A blank {@code provider} lets the model name pick the provider.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String dataDir,
    String provider,
    String model,
    double temperature
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "~/.koios/data",
            "",
            "llama3.2",
            0.5
        );
    }
}
