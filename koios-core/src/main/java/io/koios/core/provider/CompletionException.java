package io.koios.core.provider;

/**
 * The completion backend was unreachable or rejected the request. Fatal for the
 * current invocation: no answer can be produced.
 */
public final class CompletionException extends RuntimeException {
    private final String provider;

    public CompletionException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
