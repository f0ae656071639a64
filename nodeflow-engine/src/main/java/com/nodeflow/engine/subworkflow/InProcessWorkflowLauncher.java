package com.nodeflow.engine.subworkflow;

import com.nodeflow.engine.GraphScheduler;
import com.nodeflow.engine.RunOptions;
import com.nodeflow.engine.RunTrace;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.node.CallStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs nested workflows in this process: looks the target up in a {@link WorkflowCatalog} and runs it with the
 * {@link GraphScheduler} on {@code executor}, passing the request's call stack on.
 * <p>
 * Like a remote trigger endpoint, it refuses a request whose target already appears earlier on the call stack
 * (status 409, circular). A nested run that ends in {@code error} or {@code timeout} fails the launch; the
 * failure is circular when the nested run failed on a circular dependency.
 * <p>
 * The scheduler is supplied lazily because the scheduler's registry usually contains the
 * {@link SubworkflowInvoker} that uses this launcher.
 */
public final class InProcessWorkflowLauncher implements WorkflowLauncher {

    private static final Logger log = LoggerFactory.getLogger(InProcessWorkflowLauncher.class);

    private final WorkflowCatalog catalog;
    private final Supplier<GraphScheduler> scheduler;
    private final Executor executor;

    public InProcessWorkflowLauncher(WorkflowCatalog catalog, Supplier<GraphScheduler> scheduler, Executor executor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Map<String, Object>> launch(SubworkflowRequest request) {
        String workflowId = request.workflowId();
        CallStack callStack = request.callStack();
        List<String> callers = callStack.asList();
        List<String> above = !callers.isEmpty() && workflowId.equals(callers.get(callers.size() - 1))
                ? callers.subList(0, callers.size() - 1) : callers;
        if (above.contains(workflowId)) {
            return CompletableFuture.failedFuture(new WorkflowLaunchException(workflowId,
                    "Circular workflow dependency detected: " + CallStack.of(above).describeCycle(workflowId),
                    409, true));
        }
        Optional<WorkflowGraph> graph = catalog.find(workflowId);
        if (graph.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new WorkflowLaunchException(workflowId, "Workflow not found: " + workflowId, 404, false));
        }
        if (log.isDebugEnabled()) {
            log.debug("In-process launch | workflowId={} | callStack={}", workflowId, callStack);
        }
        RunOptions options = RunOptions.builder()
                .workflowId(workflowId)
                .callStack(callStack)
                .build();
        return CompletableFuture.supplyAsync(
                () -> toResult(workflowId, scheduler.get().run(graph.get(), DataEnvelope.input(request.prompt()), options)),
                executor);
    }

    private static Map<String, Object> toResult(String workflowId, RunTrace trace) {
        if (!trace.isCompleted()) {
            DataEnvelope failure = trace.getFailure();
            boolean circular = failure != null && failure.getMeta().getErrorKind() == ErrorKind.CIRCULAR_DEPENDENCY;
            throw new WorkflowLaunchException(workflowId,
                    "Workflow " + workflowId + " failed: " + trace.getErrorMessage(), 500, circular);
        }
        DataEnvelope last = trace.getFinalOutput();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", trace.getStatus().toValue());
        result.put("runId", trace.getRunId());
        result.put("output", last != null ? last.firstJson() : null);
        return result;
    }
}
