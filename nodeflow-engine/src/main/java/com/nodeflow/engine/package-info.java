/**
 * Execution core.
 * <ul>
 *   <li>{@link com.nodeflow.engine.GraphScheduler} – validates a graph and runs it node by node into a {@link com.nodeflow.engine.RunTrace}</li>
 *   <li>{@link com.nodeflow.engine.TimeoutGuard} – races a future against a deadline</li>
 *   <li>{@link com.nodeflow.engine.BranchRouter} – picks the outgoing edges a result fires</li>
 *   <li>{@link com.nodeflow.engine.NodeflowEngine} – wires configuration, scriptlets, built-in executors and the scheduler</li>
 * </ul>
 * Built-in node types live in {@code com.nodeflow.engine.executors}; sub-workflow triggering in
 * {@code com.nodeflow.engine.subworkflow}.
 */
package com.nodeflow.engine;
