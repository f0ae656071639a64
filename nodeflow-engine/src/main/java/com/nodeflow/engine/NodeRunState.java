package com.nodeflow.engine;

import com.nodeflow.envelope.DataEnvelope;

import java.time.Instant;
import java.util.Objects;

/**
 * One node state change. {@code envelope} is set for {@link NodeRunStatus#COMPLETED} and {@link NodeRunStatus#ERROR}.
 */
public record NodeRunState(String nodeId, String nodeType, NodeRunStatus status, DataEnvelope envelope, Instant timestamp) {

    public NodeRunState {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(status, "status");
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    static NodeRunState running(String nodeId, String nodeType) {
        return new NodeRunState(nodeId, nodeType, NodeRunStatus.RUNNING, null, null);
    }

    static NodeRunState skipped(String nodeId, String nodeType) {
        return new NodeRunState(nodeId, nodeType, NodeRunStatus.SKIPPED, null, null);
    }

    static NodeRunState finished(String nodeId, String nodeType, DataEnvelope envelope) {
        NodeRunStatus status = envelope.isError() ? NodeRunStatus.ERROR : NodeRunStatus.COMPLETED;
        return new NodeRunState(nodeId, nodeType, status, envelope, null);
    }
}
