package com.nodeflow.graph.validate;

import com.nodeflow.graph.GraphEdge;
import com.nodeflow.graph.GraphNode;
import com.nodeflow.graph.WorkflowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single responsibility: index a graph's edges by source and target node, preserving declaration order.
 * Build only from a graph that passed {@link GraphValidator#validateStructure}.
 */
public final class GraphTopology {

    private final Map<String, GraphNode> nodesById = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> incoming = new LinkedHashMap<>();

    public GraphTopology(WorkflowGraph graph) {
        for (GraphNode node : graph.getNodes()) {
            nodesById.put(node.getId(), node);
            outgoing.put(node.getId(), new ArrayList<>());
            incoming.put(node.getId(), new ArrayList<>());
        }
        for (GraphEdge edge : graph.getEdges()) {
            List<GraphEdge> out = outgoing.get(edge.getSourceNodeId());
            List<GraphEdge> in = incoming.get(edge.getTargetNodeId());
            if (out != null && in != null) {
                out.add(edge);
                in.add(edge);
            }
        }
    }

    public GraphNode node(String nodeId) {
        return nodesById.get(nodeId);
    }

    /** Nodes in declaration order. */
    public List<GraphNode> nodes() {
        return List.copyOf(nodesById.values());
    }

    public List<GraphEdge> outgoing(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<GraphEdge> incoming(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, List.of()));
    }

    /** Nodes without incoming edges, in declaration order. */
    public List<String> sources() {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, List<GraphEdge>> e : incoming.entrySet()) {
            if (e.getValue().isEmpty()) result.add(e.getKey());
        }
        return result;
    }

    /**
     * Kahn ordering: sources first in declaration order, then each node once all its upstream nodes are placed.
     * Nodes on a cycle are left out, so a result shorter than the node count means the graph is cyclic.
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> pending = new LinkedHashMap<>();
        for (Map.Entry<String, List<GraphEdge>> e : incoming.entrySet()) {
            pending.put(e.getKey(), e.getValue().size());
        }
        Deque<String> queue = new ArrayDeque<>(sources());
        List<String> order = new ArrayList<>(nodesById.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (GraphEdge edge : outgoing.get(id)) {
                int left = pending.merge(edge.getTargetNodeId(), -1, Integer::sum);
                if (left == 0) queue.add(edge.getTargetNodeId());
            }
        }
        return order;
    }
}
