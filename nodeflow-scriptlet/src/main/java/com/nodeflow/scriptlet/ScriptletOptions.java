package com.nodeflow.scriptlet;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-evaluation options.
 *
 * @param timeout  abort the script after this long; zero or negative means no deadline
 * @param async    run on the evaluator's worker pool instead of the calling thread
 * @param useCache reuse and store results in the evaluator's result cache
 */
public record ScriptletOptions(Duration timeout, boolean async, boolean useCache) {

    public ScriptletOptions {
        Objects.requireNonNull(timeout, "timeout");
    }

    public static ScriptletOptions sync(Duration timeout) {
        return new ScriptletOptions(timeout, false, false);
    }

    public static ScriptletOptions async(Duration timeout) {
        return new ScriptletOptions(timeout, true, false);
    }

    public ScriptletOptions withCache(boolean enabled) {
        return new ScriptletOptions(timeout, async, enabled);
    }

    boolean hasDeadline() {
        return !timeout.isZero() && !timeout.isNegative();
    }
}
