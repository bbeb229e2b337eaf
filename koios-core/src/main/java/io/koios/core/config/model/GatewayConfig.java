package io.koios.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String host,
    int port,
    int workerThreads,
    int requestTimeoutSeconds,
    List<String> approvedUserIds
) {

    public GatewayConfig {
        approvedUserIds = approvedUserIds == null ? List.of() : List.copyOf(approvedUserIds);
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig("0.0.0.0", 8787, 16, 60, List.of());
    }

    public GatewayConfig withApprovedUserIds(List<String> approvedUserIds) {
        return new GatewayConfig(host, port, workerThreads, requestTimeoutSeconds, approvedUserIds);
    }
}
