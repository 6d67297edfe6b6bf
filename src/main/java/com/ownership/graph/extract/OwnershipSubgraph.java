package com.ownership.graph.extract;

import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The connected component of the crawl graph that contains the seed property.
 * Every edge's endpoints are among {@code nodes}.
 *
 * @param seedNodeId id of the seed property node
 * @param nodes      nodes reachable from the seed, in BFS order starting with the seed
 * @param edges      edges between those nodes, in discovery order
 */
public record OwnershipSubgraph(String seedNodeId, List<GraphNode> nodes, List<GraphEdge> edges) {

    public OwnershipSubgraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public Map<String, GraphNode> nodesById() {
        return nodes.stream().collect(Collectors.toMap(GraphNode::getId, Function.identity(), (a, b) -> a));
    }

    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.getKind() == kind).toList();
    }

    public List<GraphEdge> edgesTouching(String nodeId) {
        return edges.stream().filter(e -> e.touches(nodeId)).toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
