package com.nodeflow.engine.subworkflow;

/**
 * A nested workflow could not be started or did not finish successfully.
 */
public class WorkflowLaunchException extends RuntimeException {

    private final String workflowId;
    private final int status;
    private final boolean circular;

    public WorkflowLaunchException(String workflowId, String message, int status, boolean circular) {
        super(message);
        this.workflowId = workflowId;
        this.status = status;
        this.circular = circular;
    }

    public WorkflowLaunchException(String workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.status = 0;
        this.circular = false;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /** Status reported by the launcher boundary (HTTP status for remote launches); 0 when not applicable. */
    public int getStatus() {
        return status;
    }

    /** True when the call was refused because the target is already on the call stack. */
    public boolean isCircular() {
        return circular;
    }
}
