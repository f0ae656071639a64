package com.nodeflow.engine.subworkflow;

import com.nodeflow.node.CallStack;

import java.util.Objects;

/**
 * One nested-workflow call.
 *
 * @param workflowId target workflow
 * @param prompt     input value handed to the target's entry node
 * @param callStack  chain of workflows above the target, ending with {@code workflowId}
 * @param metadata   origin of the call
 */
public record SubworkflowRequest(String workflowId, Object prompt, CallStack callStack, Metadata metadata) {

    /** Origin of a call made by a {@code workflow_trigger} node. */
    public static final String SOURCE_TRIGGER_NODE = "workflowTriggerNode";

    public SubworkflowRequest {
        Objects.requireNonNull(workflowId, "workflowId");
        callStack = callStack != null ? callStack : CallStack.of(workflowId);
    }

    /**
     * @param source           who made the call
     * @param sourceNodeId     calling node
     * @param parentWorkflowId calling workflow
     */
    public record Metadata(String source, String sourceNodeId, String parentWorkflowId) {
    }
}
