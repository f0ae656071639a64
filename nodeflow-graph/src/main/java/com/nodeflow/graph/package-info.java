/**
 * Workflow graph definition: {@link com.nodeflow.graph.GraphNode}s connected by labeled
 * {@link com.nodeflow.graph.GraphEdge}s, loaded from JSON via {@link com.nodeflow.graph.WorkflowGraphConfig}.
 * Static validation (ids, dangling edges, cycles) lives in {@code com.nodeflow.graph.validate}.
 */
package com.nodeflow.graph;
