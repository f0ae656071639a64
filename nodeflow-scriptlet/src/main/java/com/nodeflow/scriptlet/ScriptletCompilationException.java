package com.nodeflow.scriptlet;

/**
 * Thrown when scriptlet source does not parse.
 */
public final class ScriptletCompilationException extends RuntimeException {

    public ScriptletCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
