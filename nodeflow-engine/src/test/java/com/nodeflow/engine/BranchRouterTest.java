package com.nodeflow.engine;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.graph.GraphEdge;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.PortNames;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BranchRouterTest {

    private static final NodeDefinition DECISION = NodeDefinition.builder("decision")
            .output(PortNames.TRUE)
            .output(PortNames.FALSE)
            .output(PortNames.ERROR)
            .build();

    private static final NodeDefinition PLAIN = NodeDefinition.builder("plain")
            .output(PortNames.OUTPUT)
            .output(PortNames.ERROR)
            .build();

    private static final List<GraphEdge> DECISION_EDGES = List.of(
            GraphEdge.of("d", "true", "yes"),
            GraphEdge.of("d", "false", "no"),
            GraphEdge.of("d", "error", "oops"));

    private final BranchRouter router = new BranchRouter();

    @Test
    void route_outputPortInMeta_firesOnlyThatBranch() {
        DataEnvelope envelope = DataEnvelope.ofJson(1, Instant.now()).withOutputPort("false");

        List<GraphEdge> fired = router.route(DECISION, envelope, DECISION_EDGES);

        assertEquals(1, fired.size());
        assertEquals("no", fired.get(0).getTargetNodeId());
    }

    @Test
    void route_errorEnvelope_firesOnlyErrorEdges() {
        DataEnvelope envelope = DataEnvelope.error(ErrorKind.EXECUTION, "boom", Instant.now()).withOutputPort("true");

        List<GraphEdge> fired = router.route(DECISION, envelope, DECISION_EDGES);

        assertEquals(List.of("oops"), fired.stream().map(GraphEdge::getTargetNodeId).toList());
    }

    @Test
    void route_noHandle_leavesDefaultOutputPort() {
        List<GraphEdge> edges = List.of(
                GraphEdge.of("p", "next"),
                GraphEdge.of("p", "success", "also"),
                GraphEdge.of("p", "error", "handler"));

        List<GraphEdge> fired = router.route(PLAIN, DataEnvelope.ofJson("x", Instant.now()), edges);

        assertEquals(List.of("next", "also"), fired.stream().map(GraphEdge::getTargetNodeId).toList());
    }

    @Test
    void selectedPort_defaultsToFirstNonErrorOutput() {
        assertEquals("true", router.selectedPort(DECISION, DataEnvelope.ofJson(1, Instant.now())));
        assertEquals("output", router.selectedPort(PLAIN, DataEnvelope.ofJson(1, Instant.now())));
    }
}
