/**
 * Contract between the scheduler and node implementations.
 * <ul>
 *   <li>{@link com.nodeflow.node.NodeExecutor} – one implementation per node type</li>
 *   <li>{@link com.nodeflow.node.NodeDefinition} – static ports and default configuration of a type</li>
 *   <li>{@link com.nodeflow.node.NodeExecutorRegistry} – executors keyed by type string</li>
 *   <li>{@link com.nodeflow.node.CallStack} – immutable chain of nested workflow ids</li>
 *   <li>{@link com.nodeflow.node.NodeExecutionContext} – run, node and call-stack identity for one execution</li>
 * </ul>
 */
package com.nodeflow.node;
