/**
 * Nested workflow invocation: the {@code workflow_trigger} node ({@link com.nodeflow.engine.subworkflow.SubworkflowInvoker}),
 * the {@link com.nodeflow.engine.subworkflow.WorkflowLauncher} boundary it delegates to, and an in-process launcher
 * backed by a {@link com.nodeflow.engine.subworkflow.WorkflowCatalog}.
 */
package com.nodeflow.engine.subworkflow;
