package com.nodeflow.features.metrics;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.engine.NodeflowEngine;
import com.nodeflow.engine.RunOptions;
import com.nodeflow.engine.RunStatus;
import com.nodeflow.engine.RunTrace;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.graph.WorkflowGraphConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class NodeMetricsListenerTest {

    private static final WorkflowGraph APPROVAL = WorkflowGraphConfig.fromJson("""
            {
              "id": "approval",
              "nodes": [
                { "id": "entry", "type": "trigger" },
                { "id": "decide", "type": "decision", "data": { "condition": "value > 3" } },
                { "id": "A", "type": "output" },
                { "id": "B", "type": "output" }
              ],
              "edges": [
                { "source": "entry", "target": "decide" },
                { "source": "decide", "sourceHandle": "true", "target": "A" },
                { "source": "decide", "sourceHandle": "false", "target": "B" }
              ]
            }
            """);

    private static final WorkflowGraph FAILING = WorkflowGraphConfig.fromJson("""
            {
              "id": "failing",
              "nodes": [
                { "id": "entry", "type": "trigger" },
                { "id": "fn", "type": "function", "config": { "code": "throw new Error('no way');" } }
              ],
              "edges": [ { "source": "entry", "target": "fn" } ]
            }
            """);

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final NodeMetricsListener listener = new NodeMetricsListener(registry);
    private final NodeflowEngine engine = NodeflowEngine.builder().config(NodeflowConfig.defaults()).build();

    @AfterEach
    void close() {
        engine.close();
    }

    private RunTrace run(WorkflowGraph graph, Object input) {
        return engine.run(graph, DataEnvelope.input(input), RunOptions.builder().listener(listener).build());
    }

    private double executions(String nodeType, String status) {
        Counter counter = registry.find(NodeMetricsListener.NODE_EXECUTIONS)
                .tag("nodeType", nodeType).tag("status", status).counter();
        return counter != null ? counter.count() : 0;
    }

    @Test
    void branchRun_countsExecutedAndSkippedNodes() {
        RunTrace trace = run(APPROVAL, 5);

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals(1, executions("trigger", "completed"));
        assertEquals(1, executions("decision", "completed"));
        assertEquals(1, executions("output", "completed"));
        assertEquals(1, executions("output", "skipped"));
        Timer decision = registry.find(NodeMetricsListener.NODE_DURATION)
                .tag("nodeType", "decision").tag("status", "completed").timer();
        assertNotNull(decision);
        assertEquals(1, decision.count());
        assertNull(registry.find(NodeMetricsListener.NODE_DURATION).tag("status", "skipped").timer());
        assertEquals(1, registry.get(NodeMetricsListener.RUN_COMPLETIONS).tag("status", "completed").counter().count());
        assertEquals(1, registry.get(NodeMetricsListener.RUN_DURATION).tag("status", "completed").timer().count());
    }

    @Test
    void failingRun_countsErrorByKind() {
        run(FAILING, "x");
        run(FAILING, "y");

        assertEquals(2, executions("function", "error"));
        assertEquals(2, registry.get(NodeMetricsListener.NODE_ERRORS)
                .tag("nodeType", "function").tag("errorKind", "ExecutionError").counter().count());
        assertEquals(2, registry.get(NodeMetricsListener.RUN_COMPLETIONS).tag("status", "error").counter().count());
    }

    @Test
    void noArgListeners_shareOneRegistry() {
        assertSame(new NodeMetricsListener().getRegistry(), new NodeMetricsListener().getRegistry());
    }
}
