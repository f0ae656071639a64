package com.nodeflow.features.metrics;

import com.nodeflow.engine.NodeRunState;
import com.nodeflow.engine.NodeRunStatus;
import com.nodeflow.engine.RunListener;
import com.nodeflow.engine.RunTrace;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records node and run metrics:
 * <ul>
 *   <li>{@code nodeflow.node.executions} counter, tags {@code nodeType}, {@code status} (completed, error, skipped)</li>
 *   <li>{@code nodeflow.node.duration} timer, tags {@code nodeType}, {@code status}, from the envelope's start and end</li>
 *   <li>{@code nodeflow.node.errors} counter, tags {@code nodeType}, {@code errorKind}</li>
 *   <li>{@code nodeflow.run.completions} counter and {@code nodeflow.run.duration} timer, tag {@code status}</li>
 * </ul>
 * Without an explicit registry, a process-wide {@link SimpleMeterRegistry} is created on first use (lock-free CAS)
 * and shared by every listener built with the no-arg constructor.
 */
public final class NodeMetricsListener implements RunListener {

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    static final String NODE_EXECUTIONS = "nodeflow.node.executions";
    static final String NODE_DURATION = "nodeflow.node.duration";
    static final String NODE_ERRORS = "nodeflow.node.errors";
    static final String RUN_COMPLETIONS = "nodeflow.run.completions";
    static final String RUN_DURATION = "nodeflow.run.duration";

    private final MeterRegistry registry;

    public NodeMetricsListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public NodeMetricsListener() {
        this(sharedRegistry());
    }

    /** Returns the shared registry, creating it on first call. At most one is ever created. */
    static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onNodeStateChange(String nodeId, NodeRunState state) {
        if (!state.status().isTerminal()) {
            return;
        }
        String nodeType = state.nodeType() != null && !state.nodeType().isBlank() ? state.nodeType() : "unknown";
        String status = state.status().toValue();
        registry.counter(NODE_EXECUTIONS, "nodeType", nodeType, "status", status).increment();

        DataEnvelope envelope = state.envelope();
        if (envelope == null) {
            return;
        }
        Timer.builder(NODE_DURATION)
                .tag("nodeType", nodeType)
                .tag("status", status)
                .register(registry)
                .record(Math.max(0, envelope.getMeta().getDurationMs()), TimeUnit.MILLISECONDS);
        if (state.status() == NodeRunStatus.ERROR) {
            ErrorKind kind = envelope.getMeta().getErrorKind();
            registry.counter(NODE_ERRORS, "nodeType", nodeType,
                    "errorKind", kind != null ? kind.toValue() : "unknown").increment();
        }
    }

    @Override
    public void onComplete(RunTrace trace) {
        String status = trace.getStatus().toValue();
        registry.counter(RUN_COMPLETIONS, "status", status).increment();
        Timer.builder(RUN_DURATION)
                .tag("status", status)
                .register(registry)
                .record(trace.getDuration().toNanos(), TimeUnit.NANOSECONDS);
    }
}
