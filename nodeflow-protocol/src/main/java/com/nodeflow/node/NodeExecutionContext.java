package com.nodeflow.node;

import java.util.Objects;

/**
 * Identity of one node execution: the run, the workflow being run, the node, and the sub-workflow call stack.
 */
public record NodeExecutionContext(String runId, String workflowId, String nodeId, CallStack callStack) {

    public NodeExecutionContext {
        Objects.requireNonNull(runId, "runId");
        callStack = callStack != null ? callStack : CallStack.empty();
    }

    /** Context for invoking an executor outside a scheduled run (tests, previews). */
    public static NodeExecutionContext standalone(String nodeId, CallStack callStack) {
        return new NodeExecutionContext("standalone", null, nodeId, callStack);
    }

    public NodeExecutionContext forNode(String otherNodeId) {
        return new NodeExecutionContext(runId, workflowId, otherNodeId, callStack);
    }
}
