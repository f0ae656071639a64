package com.nodeflow.engine;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.graph.GraphEdge;
import com.nodeflow.graph.GraphNode;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.graph.validate.GraphTopology;
import com.nodeflow.graph.validate.GraphValidationException;
import com.nodeflow.graph.validate.GraphValidator;
import com.nodeflow.graph.validate.MalformedGraphException;
import com.nodeflow.node.CallStack;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.NodeExecutorRegistry;
import com.nodeflow.node.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs a workflow graph.
 * <p>
 * Before any node executes the graph is validated: structure, edge cycles, registered node types and each
 * executor's configuration check. A rejected graph still fires {@link RunListener#onComplete} (with an error
 * trace) and then the validation exception is thrown.
 * <p>
 * Nodes are dispatched from a queue in topological order: a node is queued once every upstream node has
 * settled (executed or skipped). Its inputs are the envelopes delivered on its fired incoming edges, merged
 * per port in edge-declaration order. A node with incoming edges of which none fired, or with a required
 * port left empty, is skipped and fires nothing downstream. Each execution is bounded by the node timeout;
 * a breach becomes an error envelope of kind {@link ErrorKind#TIMEOUT}. Error envelopes travel only on
 * {@code error} edges; an error with no such edge is unhandled and decides the run status.
 * <p>
 * An executor that throws, fails its future or returns no envelope aborts the run.
 */
public final class GraphScheduler {

    private static final Logger log = LoggerFactory.getLogger(GraphScheduler.class);

    private final NodeExecutorRegistry registry;
    private final TimeoutGuard timeoutGuard;
    private final BranchRouter router;
    private final Duration defaultNodeTimeout;

    public GraphScheduler(NodeExecutorRegistry registry, TimeoutGuard timeoutGuard, NodeflowConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timeoutGuard = Objects.requireNonNull(timeoutGuard, "timeoutGuard");
        this.router = new BranchRouter();
        this.defaultNodeTimeout = config != null ? config.getNodeTimeout() : NodeflowConfig.defaults().getNodeTimeout();
    }

    /** Runs the graph on a thread of {@code executor}. Validation failures fail the returned future. */
    public CompletableFuture<RunTrace> runAsync(WorkflowGraph graph, DataEnvelope initialInput,
                                                RunOptions options, Executor executor) {
        return CompletableFuture.supplyAsync(() -> run(graph, initialInput, options), executor);
    }

    /**
     * Runs the graph on the calling thread and returns its trace.
     *
     * @param initialInput envelope delivered to the entry node's primary input port; may be null
     * @throws GraphValidationException when the graph is rejected before any node runs
     */
    public RunTrace run(WorkflowGraph graph, DataEnvelope initialInput, RunOptions options) {
        RunOptions opts = options != null ? options : RunOptions.defaults();
        String workflowId = opts.getWorkflowId() != null ? opts.getWorkflowId() : (graph != null ? graph.getId() : null);
        CallStack callStack = opts.getCallStack();
        if (workflowId != null && !callStack.contains(workflowId)) {
            callStack = callStack.append(workflowId);
        }
        String runId = UUID.randomUUID().toString();
        RunTrace.Builder trace = RunTrace.builder(runId, workflowId);
        log.info("Run started | runId={} | workflowId={} | callStack={}", runId, workflowId, callStack);

        Plan plan;
        try {
            plan = plan(graph, opts);
        } catch (GraphValidationException e) {
            log.warn("Run rejected | runId={} | workflowId={} | reason={}", runId, workflowId, e.getMessage());
            complete(opts, trace.rejected(e.getMessage()));
            throw e;
        }

        RunTrace result = execute(plan, initialInput, opts, trace, runId, workflowId, callStack);
        log.info("Run finished | runId={} | workflowId={} | status={} | executed={} | skipped={}",
                runId, workflowId, result.getStatus().toValue(), result.getEnvelopes().size(),
                result.getSkippedNodeIds().size());
        complete(opts, result);
        return result;
    }

    private RunTrace execute(Plan plan, DataEnvelope initialInput, RunOptions opts, RunTrace.Builder trace,
                             String runId, String workflowId, CallStack callStack) {
        GraphTopology topology = plan.topology;
        Map<String, Integer> pendingUpstream = new HashMap<>();
        for (GraphNode node : topology.nodes()) {
            pendingUpstream.put(node.getId(), topology.incoming(node.getId()).size());
        }
        Map<GraphEdge, DataEnvelope> delivered = new IdentityHashMap<>();
        Deque<String> queue = new ArrayDeque<>(topology.sources());
        long timeoutMs = (opts.getNodeTimeout() != null ? opts.getNodeTimeout() : defaultNodeTimeout).toMillis();

        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            GraphNode node = topology.node(nodeId);
            NodeExecutor executor = plan.executors.get(nodeId);
            NodeDefinition definition = executor.definition();

            Map<String, DataEnvelope> inputs = InputAssembler.assemble(definition, topology.incoming(nodeId), delivered);
            if (nodeId.equals(plan.entryNodeId) && initialInput != null) {
                inputs.put(definition.primaryInputPort(), initialInput);
            }
            if (!isReady(definition, topology.incoming(nodeId), inputs)) {
                if (log.isDebugEnabled()) {
                    log.debug("Node skipped | runId={} | nodeId={} | ports={}", runId, nodeId, inputs.keySet());
                }
                trace.skipped(nodeId);
                notifyState(opts, nodeId, NodeRunState.skipped(nodeId, node.getType()));
                settle(nodeId, topology, pendingUpstream, queue);
                continue;
            }

            notifyState(opts, nodeId, NodeRunState.running(nodeId, node.getType()));
            NodeExecutionContext context = new NodeExecutionContext(runId, workflowId, nodeId, callStack);
            Map<String, Object> config = definition.effectiveConfig(node.getConfig());
            Instant start = Instant.now();
            DataEnvelope envelope;
            try {
                envelope = invoke(executor, config, inputs, context, timeoutMs, start);
            } catch (RuntimeException e) {
                Throwable cause = NodeTimeoutException.unwrap(e);
                String message = "Node " + nodeId + " failed with an internal error: "
                        + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
                log.error("Run aborted | runId={} | nodeId={} | nodeType={}", runId, nodeId, node.getType(), cause);
                DataEnvelope failure = DataEnvelope.error(ErrorKind.EXECUTION, message, start);
                trace.executed(nodeId, failure);
                notifyState(opts, nodeId, NodeRunState.finished(nodeId, node.getType(), failure));
                return trace.abort(nodeId, message);
            }

            trace.executed(nodeId, envelope);
            notifyState(opts, nodeId, NodeRunState.finished(nodeId, node.getType(), envelope));
            List<GraphEdge> fired = router.route(definition, envelope, topology.outgoing(nodeId));
            if (log.isDebugEnabled()) {
                log.debug("Node finished | runId={} | nodeId={} | status={} | port={} | fired={}",
                        runId, nodeId, envelope.getMeta().getStatus().toValue(),
                        router.selectedPort(definition, envelope), fired.size());
            }
            if (envelope.isError() && fired.isEmpty()) {
                log.warn("Unhandled node error | runId={} | nodeId={} | kind={} | message={}",
                        runId, nodeId, envelope.getMeta().getErrorKind(), envelope.getMeta().getErrorMessage());
                trace.unhandled(nodeId);
            }
            for (GraphEdge edge : fired) {
                delivered.put(edge, envelope);
            }
            settle(nodeId, topology, pendingUpstream, queue);
        }
        return trace.finish();
    }

    private DataEnvelope invoke(NodeExecutor executor, Map<String, Object> config, Map<String, DataEnvelope> inputs,
                                NodeExecutionContext context, long timeoutMs, Instant start) {
        DataEnvelope envelope;
        try {
            envelope = timeoutGuard.withTimeout(() -> executor.execute(config, inputs, context), timeoutMs,
                    "Node " + context.nodeId()).join();
        } catch (CompletionException | CancellationException e) {
            if (NodeTimeoutException.isTimeout(e)) {
                NodeTimeoutException timeout = (NodeTimeoutException) NodeTimeoutException.unwrap(e);
                return DataEnvelope.error(ErrorKind.TIMEOUT, timeout.getMessage(), start);
            }
            throw e;
        }
        if (envelope == null) {
            throw new IllegalStateException("executor " + executor.type() + " returned no envelope");
        }
        return envelope;
    }

    /** Entry node receives the initial input; other nodes need a fired edge when they have any, and every required port. */
    private static boolean isReady(NodeDefinition definition, List<GraphEdge> incoming, Map<String, DataEnvelope> inputs) {
        if (!incoming.isEmpty() && inputs.isEmpty()) return false;
        for (String port : definition.requiredInputPorts()) {
            if (!inputs.containsKey(port)) return false;
        }
        return true;
    }

    private static void settle(String nodeId, GraphTopology topology, Map<String, Integer> pendingUpstream,
                               Deque<String> queue) {
        for (GraphEdge edge : topology.outgoing(nodeId)) {
            String target = edge.getTargetNodeId();
            int remaining = pendingUpstream.merge(target, -1, Integer::sum);
            if (remaining == 0) queue.add(target);
        }
    }

    private Plan plan(WorkflowGraph graph, RunOptions opts) {
        GraphTopology topology = GraphValidator.validate(graph);
        List<String> problems = new ArrayList<>();
        Map<String, NodeExecutor> executors = new LinkedHashMap<>();
        for (GraphNode node : topology.nodes()) {
            registry.find(node.getType()).ifPresentOrElse(
                    executor -> executors.put(node.getId(), executor),
                    () -> problems.add("node " + node.getId() + " has unregistered type " + node.getType()));
        }
        String entryNodeId = opts.getEntryNodeId() != null ? opts.getEntryNodeId() : graph.getEntryNodeId();
        if (entryNodeId == null) {
            entryNodeId = topology.sources().isEmpty() ? null : topology.sources().get(0);
        } else if (topology.node(entryNodeId) == null) {
            problems.add("entry node " + entryNodeId + " does not exist");
        } else if (!topology.incoming(entryNodeId).isEmpty()) {
            problems.add("entry node " + entryNodeId + " has incoming edges");
        }
        if (!problems.isEmpty()) {
            throw new MalformedGraphException(graph.getId(), problems);
        }

        Map<String, List<String>> configErrors = new LinkedHashMap<>();
        for (GraphNode node : topology.nodes()) {
            NodeExecutor executor = executors.get(node.getId());
            ValidationResult result = executor.validate(executor.definition().effectiveConfig(node.getConfig()));
            if (!result.isValid()) {
                configErrors.put(node.getId(), result.getErrors());
            }
        }
        if (!configErrors.isEmpty()) {
            throw new NodeConfigurationException(graph.getId(), configErrors);
        }
        return new Plan(topology, executors, entryNodeId);
    }

    private static void notifyState(RunOptions opts, String nodeId, NodeRunState state) {
        for (RunListener listener : opts.getListeners()) {
            try {
                listener.onNodeStateChange(nodeId, state);
            } catch (RuntimeException e) {
                log.warn("Listener failed | event=nodeStateChange | nodeId={} | status={}",
                        nodeId, state.status().toValue(), e);
            }
        }
    }

    private static void complete(RunOptions opts, RunTrace trace) {
        for (RunListener listener : opts.getListeners()) {
            try {
                listener.onComplete(trace);
            } catch (RuntimeException e) {
                log.warn("Listener failed | event=complete | runId={}", trace.getRunId(), e);
            }
        }
    }

    private static final class Plan {
        final GraphTopology topology;
        final Map<String, NodeExecutor> executors;
        final String entryNodeId;

        Plan(GraphTopology topology, Map<String, NodeExecutor> executors, String entryNodeId) {
            this.topology = topology;
            this.executors = executors;
            this.entryNodeId = entryNodeId;
        }
    }
}
