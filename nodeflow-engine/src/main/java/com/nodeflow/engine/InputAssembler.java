package com.nodeflow.engine;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.EnvelopeMeta;
import com.nodeflow.envelope.EnvelopeStatus;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.graph.GraphEdge;
import com.nodeflow.node.NodeDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Single responsibility: turn the envelopes delivered on a node's incoming edges into its inputs by port.
 * <p>
 * Edges are read in declaration order. An edge without a target handle delivers to the primary input port.
 * Several envelopes on one port are merged into one: items concatenated in edge order, the earliest start
 * and latest end, and error status only when every contributor is an error.
 */
final class InputAssembler {

    static final String FAN_IN_ATTRIBUTE = "fanIn";

    private InputAssembler() {
    }

    static Map<String, DataEnvelope> assemble(NodeDefinition definition,
                                              List<GraphEdge> incoming,
                                              Map<GraphEdge, DataEnvelope> delivered) {
        Map<String, List<DataEnvelope>> byPort = new LinkedHashMap<>();
        for (GraphEdge edge : incoming) {
            DataEnvelope envelope = delivered.get(edge);
            if (envelope == null) continue;
            String port = edge.getTargetHandle() != null ? edge.getTargetHandle() : definition.primaryInputPort();
            byPort.computeIfAbsent(port, p -> new ArrayList<>()).add(envelope);
        }
        Map<String, DataEnvelope> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, List<DataEnvelope>> e : byPort.entrySet()) {
            inputs.put(e.getKey(), merge(e.getValue()));
        }
        return inputs;
    }

    static DataEnvelope merge(List<DataEnvelope> envelopes) {
        if (envelopes.size() == 1) return envelopes.get(0);
        List<WorkflowItem> items = new ArrayList<>();
        Instant start = null;
        Instant end = null;
        boolean allErrors = true;
        StringJoiner messages = new StringJoiner("; ");
        for (DataEnvelope envelope : envelopes) {
            items.addAll(envelope.getItems());
            EnvelopeMeta meta = envelope.getMeta();
            if (meta.getStartTime() != null && (start == null || meta.getStartTime().isBefore(start))) {
                start = meta.getStartTime();
            }
            if (meta.getEndTime() != null && (end == null || meta.getEndTime().isAfter(end))) {
                end = meta.getEndTime();
            }
            if (envelope.isError()) {
                messages.add(meta.getErrorMessage());
            } else {
                allErrors = false;
            }
        }
        EnvelopeMeta.Builder meta = EnvelopeMeta.builder()
                .startTime(start)
                .endTime(end)
                .attribute(FAN_IN_ATTRIBUTE, envelopes.size());
        if (allErrors) {
            meta.error(envelopes.get(0).getMeta().getErrorKind(), messages.toString());
        } else {
            meta.status(EnvelopeStatus.SUCCESS);
        }
        return new DataEnvelope(items, meta.build());
    }
}
