package com.nodeflow.scriptlet;

/**
 * Thrown when a scriptlet fails at runtime. The message is the script-level error text, e.g. {@code Error: x}.
 */
public final class ScriptletExecutionException extends RuntimeException {

    public ScriptletExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
