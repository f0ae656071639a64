package com.nodeflow.engine;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.EnvelopeMeta;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.graph.GraphEdge;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.PortDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputAssemblerTest {

    private static final NodeDefinition JOIN = NodeDefinition.builder("join")
            .input(PortDefinition.required("data"))
            .input(PortDefinition.optional("extra"))
            .build();

    private static DataEnvelope envelope(Object json, Instant start, Instant end) {
        return new DataEnvelope(List.of(WorkflowItem.of(json)),
                EnvelopeMeta.builder().startTime(start).endTime(end).build());
    }

    @Test
    void assemble_mergesPerPortInEdgeDeclarationOrder() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        GraphEdge fromB = GraphEdge.of("b", null, "join", null);
        GraphEdge fromA = GraphEdge.of("a", null, "join", null);
        GraphEdge side = GraphEdge.of("c", null, "join", "extra");
        Map<GraphEdge, DataEnvelope> delivered = new IdentityHashMap<>();
        delivered.put(fromA, envelope("a", t0, t0.plusSeconds(5)));
        delivered.put(side, envelope("c", t0, t0));
        delivered.put(fromB, envelope("b", t0.plusSeconds(1), t0.plusSeconds(9)));

        Map<String, DataEnvelope> inputs = InputAssembler.assemble(JOIN, List.of(fromB, fromA, side), delivered);

        assertEquals(List.of("data", "extra"), List.copyOf(inputs.keySet()));
        DataEnvelope merged = inputs.get("data");
        assertEquals(List.of("b", "a"), merged.jsonValues());
        assertEquals(t0, merged.getMeta().getStartTime());
        assertEquals(t0.plusSeconds(9), merged.getMeta().getEndTime());
        assertFalse(merged.isError());
        assertEquals(2, merged.getMeta().getAttribute(InputAssembler.FAN_IN_ATTRIBUTE));
    }

    @Test
    void assemble_undeliveredEdgesAreIgnored() {
        GraphEdge fired = GraphEdge.of("a", "join");
        GraphEdge silent = GraphEdge.of("b", "join");
        DataEnvelope only = DataEnvelope.ofJson(1, Instant.now());
        Map<GraphEdge, DataEnvelope> delivered = new IdentityHashMap<>();
        delivered.put(fired, only);

        Map<String, DataEnvelope> inputs = InputAssembler.assemble(JOIN, List.of(fired, silent), delivered);

        assertSame(only, inputs.get("data"));
    }

    @Test
    void merge_isErrorOnlyWhenEveryContributorIs() {
        DataEnvelope ok = DataEnvelope.ofJson(1, Instant.now());
        DataEnvelope bad = DataEnvelope.error(ErrorKind.TIMEOUT, "late", Instant.now());
        DataEnvelope worse = DataEnvelope.error(ErrorKind.EXECUTION, "boom", Instant.now());

        assertFalse(InputAssembler.merge(List.of(ok, bad)).isError());
        DataEnvelope allBad = InputAssembler.merge(List.of(bad, worse));
        assertTrue(allBad.isError());
        assertEquals("late; boom", allBad.getMeta().getErrorMessage());
        assertEquals(ErrorKind.TIMEOUT, allBad.getMeta().getErrorKind());
    }
}
