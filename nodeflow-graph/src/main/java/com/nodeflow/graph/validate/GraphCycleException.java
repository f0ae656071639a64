package com.nodeflow.graph.validate;

import java.util.List;

/**
 * Thrown when the edges of a graph form a cycle. {@link #getCyclePath()} starts and ends with the same node.
 */
public final class GraphCycleException extends GraphValidationException {

    private final List<String> cyclePath;

    public GraphCycleException(String graphId, List<String> cyclePath) {
        super(graphId, "Cycle detected in workflow at node " + cyclePath.get(0) + ": " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
