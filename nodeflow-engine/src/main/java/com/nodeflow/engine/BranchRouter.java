package com.nodeflow.engine;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.graph.GraphEdge;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.PortNames;

import java.util.ArrayList;
import java.util.List;

/**
 * Single responsibility: decide which outgoing edges a node's output fires.
 * <p>
 * The selected port is {@value PortNames#ERROR} for an error envelope, otherwise the port named in
 * {@code meta.outputPort}, otherwise the definition's default output port. An edge fires when its source
 * port equals the selected port; an edge without a source handle (or with {@code "default"} or
 * {@code "success"}) leaves the default output port.
 */
public final class BranchRouter {

    private static final String DEFAULT_HANDLE = "default";
    private static final String SUCCESS_HANDLE = "success";

    public String selectedPort(NodeDefinition definition, DataEnvelope envelope) {
        if (envelope.isError()) return PortNames.ERROR;
        String port = envelope.getMeta().getOutputPort();
        return port != null ? port : definition.defaultOutputPort();
    }

    public String sourcePort(NodeDefinition definition, GraphEdge edge) {
        String handle = edge.getSourceHandle();
        if (handle == null || DEFAULT_HANDLE.equals(handle) || SUCCESS_HANDLE.equals(handle)) {
            return definition.defaultOutputPort();
        }
        return handle;
    }

    /** Edges among {@code outgoing} that fire for {@code envelope}, in declaration order. */
    public List<GraphEdge> route(NodeDefinition definition, DataEnvelope envelope, List<GraphEdge> outgoing) {
        String selected = selectedPort(definition, envelope);
        List<GraphEdge> fired = new ArrayList<>();
        for (GraphEdge edge : outgoing) {
            if (selected.equals(sourcePort(definition, edge))) fired.add(edge);
        }
        return fired;
    }
}
