/**
 * Built-in node executors. {@link com.nodeflow.engine.executors.BuiltinNodeExecutors#registerAll} registers
 * every type on a {@link com.nodeflow.node.NodeExecutorRegistry}.
 */
package com.nodeflow.engine.executors;
