/**
 * HTTP boundary for nested workflows: {@link com.nodeflow.trigger.http.HttpWorkflowLauncher} calls
 * {@code POST /api/workflows/{id}/trigger}; {@link com.nodeflow.trigger.http.WorkflowTriggerServer} serves it.
 */
package com.nodeflow.trigger.http;
