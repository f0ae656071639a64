package com.nodeflow.graph.validate;

import com.nodeflow.graph.GraphEdge;
import com.nodeflow.graph.GraphNode;
import com.nodeflow.graph.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single responsibility: reject graphs that cannot be scheduled (structure and edge cycles).
 * Node types and node configuration are checked by the engine, which owns the executor registry.
 */
public final class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    private GraphValidator() {
    }

    /**
     * Validates structure, then cycles, and returns the edge index.
     *
     * @throws MalformedGraphException on structural problems
     * @throws GraphCycleException     if the edges form a cycle
     */
    public static GraphTopology validate(WorkflowGraph graph) {
        validateStructure(graph);
        GraphTopology topology = new GraphTopology(graph);
        detectCycle(graph.getId(), topology);
        if (log.isDebugEnabled()) {
            log.debug("Graph validated | graphId={} | nodes={} | edges={}",
                    graph.getId(), graph.getNodes().size(), graph.getEdges().size());
        }
        return topology;
    }

    /**
     * Checks node ids, node types, edge endpoints and the explicit entry node.
     *
     * @throws MalformedGraphException listing every problem found
     */
    public static void validateStructure(WorkflowGraph graph) {
        if (graph == null) {
            throw new MalformedGraphException(null, List.of("graph is null"));
        }
        List<String> problems = new ArrayList<>();
        if (graph.getNodes().isEmpty()) {
            problems.add("graph has no nodes");
        }
        Set<String> ids = new HashSet<>();
        for (GraphNode node : graph.getNodes()) {
            if (node == null) {
                problems.add("null node");
                continue;
            }
            if (node.getId() == null || node.getId().isBlank()) {
                problems.add("node with blank id (type=" + node.getType() + ")");
            } else if (!ids.add(node.getId())) {
                problems.add("duplicate node id " + node.getId());
            }
            if (node.getType() == null || node.getType().isBlank()) {
                problems.add("node " + node.getId() + " has no type");
            }
        }
        for (GraphEdge edge : graph.getEdges()) {
            if (edge == null) {
                problems.add("null edge");
                continue;
            }
            if (!ids.contains(edge.getSourceNodeId())) {
                problems.add("edge " + edge + " references unknown source node " + edge.getSourceNodeId());
            }
            if (!ids.contains(edge.getTargetNodeId())) {
                problems.add("edge " + edge + " references unknown target node " + edge.getTargetNodeId());
            }
        }
        if (graph.getEntryNodeId() != null && !ids.contains(graph.getEntryNodeId())) {
            problems.add("entry node " + graph.getEntryNodeId() + " does not exist");
        }
        if (!problems.isEmpty()) {
            throw new MalformedGraphException(graph.getId(), problems);
        }
    }

    private static void detectCycle(String graphId, GraphTopology topology) {
        Map<String, Integer> color = new HashMap<>();
        for (GraphNode node : topology.nodes()) {
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(node.getId(), topology, color, path);
            if (cycle != null) {
                log.warn("Graph rejected | graphId={} | cycle={}", graphId, cycle);
                throw new GraphCycleException(graphId, cycle);
            }
        }
    }

    /** DFS with white (absent) / grey (1) / black (2) marks; returns the cycle when a grey node is reached again. */
    private static List<String> visit(String id, GraphTopology topology, Map<String, Integer> color, List<String> path) {
        Integer mark = color.get(id);
        if (mark != null && mark == 2) return null;
        if (mark != null && mark == 1) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return cycle;
        }
        color.put(id, 1);
        path.add(id);
        for (GraphEdge edge : topology.outgoing(id)) {
            List<String> cycle = visit(edge.getTargetNodeId(), topology, color, path);
            if (cycle != null) return cycle;
        }
        path.remove(path.size() - 1);
        color.put(id, 2);
        return null;
    }
}
