package com.nodeflow.engine.subworkflow;

import com.nodeflow.graph.WorkflowGraph;

import java.util.Optional;

/** Looks up workflow graphs by id. */
@FunctionalInterface
public interface WorkflowCatalog {

    Optional<WorkflowGraph> find(String workflowId);
}
