package io.koios.core.search;

public final class RateLimitedException extends WebSearchException {
    public RateLimitedException(String message) {
        super(message);
    }
}
