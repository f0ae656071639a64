package com.nodeflow.scriptlet;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * Rhino contexts for user scriptlets: interpreted mode (required for instruction observation), ES6,
 * no Java class visible to scripts. Scripts are aborted when their thread is interrupted or the deadline
 * stored under {@link #DEADLINE_KEY} (a {@code System.nanoTime()} value) has passed.
 */
final class SandboxContextFactory extends ContextFactory {

    static final Object DEADLINE_KEY = "nodeflow.scriptlet.deadlineNanos";

    private static final int INSTRUCTION_THRESHOLD = 10_000;
    private static final int MAX_STACK_DEPTH = 2_000;

    @Override
    protected Context makeContext() {
        Context cx = super.makeContext();
        cx.setLanguageVersion(Context.VERSION_ES6);
        cx.setOptimizationLevel(-1);
        cx.setInstructionObserverThreshold(INSTRUCTION_THRESHOLD);
        cx.setMaximumInterpreterStackDepth(MAX_STACK_DEPTH);
        cx.setClassShutter(className -> false);
        return cx;
    }

    @Override
    protected void observeInstructionCount(Context cx, int instructionCount) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ScriptAbort("interrupted");
        }
        Object deadline = cx.getThreadLocal(DEADLINE_KEY);
        if (deadline instanceof Long && System.nanoTime() - (Long) deadline > 0) {
            throw new ScriptAbort("deadline exceeded");
        }
    }

    /** An {@link Error} so that script-level try/catch cannot swallow it. */
    static final class ScriptAbort extends Error {
        ScriptAbort(String reason) {
            super(reason, null, false, false);
        }
    }
}
