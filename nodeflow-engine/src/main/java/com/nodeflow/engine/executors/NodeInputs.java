package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.node.NodeDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single responsibility: read the values an executor works on out of its inputs by port.
 */
public final class NodeInputs {

    private NodeInputs() {
    }

    /** Envelope on the primary input port, else the first envelope present, else null. */
    public static DataEnvelope primary(NodeDefinition definition, Map<String, DataEnvelope> inputsByPort) {
        if (inputsByPort == null || inputsByPort.isEmpty()) return null;
        DataEnvelope primary = inputsByPort.get(definition.primaryInputPort());
        if (primary != null) return primary;
        return inputsByPort.values().iterator().next();
    }

    /** Port name to the json of the first item on that port (null for an empty envelope). */
    public static Map<String, Object> firstValues(Map<String, DataEnvelope> inputsByPort) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (inputsByPort == null) return values;
        for (Map.Entry<String, DataEnvelope> e : inputsByPort.entrySet()) {
            values.put(e.getKey(), e.getValue() != null ? e.getValue().firstJson() : null);
        }
        return values;
    }
}
