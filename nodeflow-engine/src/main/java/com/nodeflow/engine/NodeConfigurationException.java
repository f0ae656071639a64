package com.nodeflow.engine;

import com.nodeflow.graph.validate.GraphValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown before a run when one or more nodes fail their executor's configuration check.
 */
public final class NodeConfigurationException extends GraphValidationException {

    private final Map<String, List<String>> errorsByNode;

    public NodeConfigurationException(String graphId, Map<String, List<String>> errorsByNode) {
        super(graphId, describe(errorsByNode));
        this.errorsByNode = Collections.unmodifiableMap(new LinkedHashMap<>(errorsByNode));
    }

    public Map<String, List<String>> getErrorsByNode() {
        return errorsByNode;
    }

    private static String describe(Map<String, List<String>> errorsByNode) {
        StringBuilder sb = new StringBuilder("Invalid node configuration");
        for (Map.Entry<String, List<String>> e : errorsByNode.entrySet()) {
            sb.append(" | ").append(e.getKey()).append(": ").append(String.join(", ", e.getValue()));
        }
        return sb.toString();
    }
}
