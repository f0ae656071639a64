package com.nodeflow.engine.subworkflow;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts another workflow and yields its result object.
 * <p>
 * Failures complete the future exceptionally, preferably with {@link WorkflowLaunchException}; a launcher that
 * refuses a call because the target is already on the call stack marks the exception circular.
 */
@FunctionalInterface
public interface WorkflowLauncher {

    CompletableFuture<Map<String, Object>> launch(SubworkflowRequest request);
}
