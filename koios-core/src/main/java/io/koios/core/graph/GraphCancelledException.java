package io.koios.core.graph;

/**
 * The invoking thread was interrupted between stages; no generation was produced.
 */
public final class GraphCancelledException extends RuntimeException {
    public GraphCancelledException(String message) {
        super(message);
    }

    public GraphCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
