package com.nodeflow.engine.subworkflow;

import com.nodeflow.graph.WorkflowGraph;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe catalog backed by a map. Registering a graph under an id that is already taken replaces it.
 */
public final class InMemoryWorkflowCatalog implements WorkflowCatalog {

    private final Map<String, WorkflowGraph> graphs = new ConcurrentHashMap<>();

    /** Registers {@code graph} under its own id. */
    public InMemoryWorkflowCatalog register(WorkflowGraph graph) {
        if (graph.getId() == null || graph.getId().isBlank()) {
            throw new IllegalArgumentException("graph has no id");
        }
        graphs.put(graph.getId(), graph);
        return this;
    }

    public InMemoryWorkflowCatalog register(String workflowId, WorkflowGraph graph) {
        return register(graph.withId(workflowId));
    }

    @Override
    public Optional<WorkflowGraph> find(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(graphs.get(workflowId));
    }
}
