package com.nodeflow.graph.validate;

import java.util.List;

/**
 * Thrown when a graph is structurally invalid: duplicate or blank node ids, edges to unknown nodes,
 * unknown node types, or an entry node that does not exist.
 */
public final class MalformedGraphException extends GraphValidationException {

    private final List<String> problems;

    public MalformedGraphException(String graphId, List<String> problems) {
        super(graphId, "Malformed workflow graph" + (graphId != null ? " " + graphId : "") + ": "
                + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
