package com.nodeflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A workflow: nodes and edges in declaration order, with an optional explicit entry node.
 * Edge declaration order is significant; fan-in merges follow it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowGraph {

    private final String id;
    private final String name;
    private final String entryNodeId;
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;

    @JsonCreator
    public WorkflowGraph(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("entryNodeId") String entryNodeId,
            @JsonProperty("nodes") List<GraphNode> nodes,
            @JsonProperty("edges") List<GraphEdge> edges) {
        this.id = id;
        this.name = name;
        this.entryNodeId = entryNodeId != null && !entryNodeId.isBlank() ? entryNodeId : null;
        this.nodes = nodes != null ? Collections.unmodifiableList(new ArrayList<>(nodes)) : List.of();
        this.edges = edges != null ? Collections.unmodifiableList(new ArrayList<>(edges)) : List.of();
    }

    public static WorkflowGraph of(List<GraphNode> nodes, List<GraphEdge> edges) {
        return new WorkflowGraph(null, null, null, nodes, edges);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Explicit entry node; null means the first node without incoming edges. */
    public String getEntryNodeId() {
        return entryNodeId;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public Optional<GraphNode> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        for (GraphNode node : nodes) {
            if (nodeId.equals(node.getId())) return Optional.of(node);
        }
        return Optional.empty();
    }

    /** Copy with a different id (used when a catalog registers a graph under its key). */
    public WorkflowGraph withId(String newId) {
        return new WorkflowGraph(newId, name, entryNodeId, nodes, edges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) o;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(entryNodeId, that.entryNodeId)
                && nodes.equals(that.nodes)
                && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, entryNodeId, nodes, edges);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{id=" + id + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
