package com.nodeflow.graph;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Directed edge from an output port of one node to an input port of another.
 * A null {@code sourceHandle} stands for the source node's default output port; a null
 * {@code targetHandle} for the target node's primary input port. {@code source}/{@code target}
 * are accepted as aliases of the node id properties.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphEdge {

    private final String id;
    private final String sourceNodeId;
    private final String sourceHandle;
    private final String targetNodeId;
    private final String targetHandle;

    @JsonCreator
    public GraphEdge(
            @JsonProperty("id") String id,
            @JsonProperty("sourceNodeId") @JsonAlias("source") String sourceNodeId,
            @JsonProperty("sourceHandle") String sourceHandle,
            @JsonProperty("targetNodeId") @JsonAlias("target") String targetNodeId,
            @JsonProperty("targetHandle") String targetHandle) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.sourceHandle = blankToNull(sourceHandle);
        this.targetNodeId = targetNodeId;
        this.targetHandle = blankToNull(targetHandle);
    }

    /** Edge between default ports. */
    public static GraphEdge of(String sourceNodeId, String targetNodeId) {
        return new GraphEdge(null, sourceNodeId, null, targetNodeId, null);
    }

    /** Edge from a named output port to the target's primary input port. */
    public static GraphEdge of(String sourceNodeId, String sourceHandle, String targetNodeId) {
        return new GraphEdge(null, sourceNodeId, sourceHandle, targetNodeId, null);
    }

    public static GraphEdge of(String sourceNodeId, String sourceHandle, String targetNodeId, String targetHandle) {
        return new GraphEdge(null, sourceNodeId, sourceHandle, targetNodeId, targetHandle);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    public String getId() {
        return id;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }

    public String getTargetHandle() {
        return targetHandle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(id, that.id)
                && Objects.equals(sourceNodeId, that.sourceNodeId)
                && Objects.equals(sourceHandle, that.sourceHandle)
                && Objects.equals(targetNodeId, that.targetNodeId)
                && Objects.equals(targetHandle, that.targetHandle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceNodeId, sourceHandle, targetNodeId, targetHandle);
    }

    @Override
    public String toString() {
        return sourceNodeId + (sourceHandle != null ? "[" + sourceHandle + "]" : "")
                + " -> " + targetNodeId + (targetHandle != null ? "[" + targetHandle + "]" : "");
    }
}
