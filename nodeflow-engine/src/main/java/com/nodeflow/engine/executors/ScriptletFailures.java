package com.nodeflow.engine.executors;

import com.nodeflow.engine.NodeTimeoutException;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.scriptlet.ScriptletCompilationException;
import com.nodeflow.scriptlet.ScriptletTimeoutException;

/**
 * Single responsibility: map scriptlet failures to an {@link ErrorKind} and a message.
 */
final class ScriptletFailures {

    private ScriptletFailures() {
    }

    static ErrorKind kindOf(Throwable t) {
        Throwable cause = NodeTimeoutException.unwrap(t);
        if (cause instanceof ScriptletCompilationException) return ErrorKind.COMPILATION;
        if (cause instanceof ScriptletTimeoutException || cause instanceof NodeTimeoutException) return ErrorKind.TIMEOUT;
        return ErrorKind.EXECUTION;
    }

    static boolean isTimeout(Throwable t) {
        return kindOf(t) == ErrorKind.TIMEOUT;
    }

    static String messageOf(Throwable t) {
        Throwable cause = NodeTimeoutException.unwrap(t);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
