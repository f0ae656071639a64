package com.nodeflow.scriptlet;

import org.mozilla.javascript.Script;

/**
 * Parsed scriptlet. Executing {@link #script()} yields the function {@code (data, inputs, value) => body}.
 * Compiled scripts are immutable and may run on any thread.
 */
public final class CompiledScriptlet {

    private final String body;
    private final String source;
    private final Script script;

    CompiledScriptlet(String body, String source, Script script) {
        this.body = body;
        this.source = source;
        this.script = script;
    }

    /** User source as written (without the generated function wrapper). */
    public String body() {
        return body;
    }

    /** Generated source that was compiled; distinguishes a condition from a body with the same text. */
    String source() {
        return source;
    }

    Script script() {
        return script;
    }
}
