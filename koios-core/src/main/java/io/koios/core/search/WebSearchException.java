package io.koios.core.search;

/**
 * A web search or fallback lookup could not produce results.
 */
public class WebSearchException extends Exception {
    public WebSearchException(String message) {
        super(message);
    }

    public WebSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
