package com.nodeflow.trigger.http;

import com.nodeflow.engine.subworkflow.WorkflowLaunchException;

import java.util.Locale;

/**
 * The trigger endpoint answered with a 4xx or 5xx status.
 */
public final class WorkflowTriggerException extends WorkflowLaunchException {

    private final String errorText;

    public WorkflowTriggerException(String workflowId, int status, String errorText) {
        super(workflowId, "Workflow " + workflowId + " trigger failed with status " + status + ": " + errorText,
                status, isCircular(status, errorText));
        this.errorText = errorText;
    }

    /** The {@code error} text of the response body, or the raw body when it has none. */
    public String getErrorText() {
        return errorText;
    }

    static boolean isCircular(int status, String errorText) {
        return status == 409 || (errorText != null && errorText.toLowerCase(Locale.ROOT).contains("circular"));
    }
}
