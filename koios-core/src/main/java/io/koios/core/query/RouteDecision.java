package io.koios.core.query;

import java.util.Locale;
import java.util.Optional;

public enum RouteDecision {
    DOC_SEARCH("doc_search"),
    WEB_SEARCH("web_search"),
    GENERATE("generate");

    private final String wireValue;

    RouteDecision(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<RouteDecision> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RouteDecision decision : values()) {
            if (decision.wireValue.equals(normalized)) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }
}
