package com.nodeflow.graph.validate;

/**
 * Base of the graph-level failures that abort a run before any node executes.
 */
public class GraphValidationException extends RuntimeException {

    private final String graphId;

    public GraphValidationException(String graphId, String message) {
        super(message);
        this.graphId = graphId;
    }

    public String getGraphId() {
        return graphId;
    }
}
