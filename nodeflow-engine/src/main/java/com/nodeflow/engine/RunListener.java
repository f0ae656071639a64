package com.nodeflow.engine;

/**
 * Observer of a run. Called on the scheduler's thread; exceptions thrown here are logged and ignored.
 */
public interface RunListener {

    /** Fired with {@link NodeRunStatus#RUNNING} before a node executes and with a terminal status after. */
    default void onNodeStateChange(String nodeId, NodeRunState state) {
    }

    /** Fired exactly once per run, also when the graph is rejected before any node runs. */
    default void onComplete(RunTrace trace) {
    }
}
