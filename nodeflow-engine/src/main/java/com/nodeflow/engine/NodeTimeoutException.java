package com.nodeflow.engine;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a future guarded by {@link TimeoutGuard} that did not settle before its deadline.
 */
public final class NodeTimeoutException extends RuntimeException {

    private final long timeoutMs;

    public NodeTimeoutException(String operation, long timeoutMs) {
        super(operation + " timed out after " + timeoutMs + "ms", null, false, false);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /** True when {@code t}, or the cause it wraps, is a {@link NodeTimeoutException}. */
    public static boolean isTimeout(Throwable t) {
        return unwrap(t) instanceof NodeTimeoutException;
    }

    /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
