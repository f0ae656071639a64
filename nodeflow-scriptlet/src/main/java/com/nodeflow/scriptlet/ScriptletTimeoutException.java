package com.nodeflow.scriptlet;

/**
 * Thrown when a scriptlet is aborted for running past its deadline or being interrupted.
 */
public final class ScriptletTimeoutException extends RuntimeException {

    private final long timeoutMs;

    public ScriptletTimeoutException(long timeoutMs) {
        super("Scriptlet execution timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
