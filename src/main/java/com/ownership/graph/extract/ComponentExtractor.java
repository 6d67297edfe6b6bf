package com.ownership.graph.extract;

import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Isolates the part of a crawl graph reachable from the seed node, ignoring edge direction.
 * A correct crawl only ever produces such a graph; the extraction does not rely on that.
 */
public class ComponentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ComponentExtractor.class);

    /**
     * @param seedNodeId id of the node to start from; it is kept even when it has no edges
     * @param nodes      all nodes of the crawl
     * @param edges      all edges of the crawl
     */
    public OwnershipSubgraph extract(String seedNodeId, Collection<GraphNode> nodes, List<GraphEdge> edges) {
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            byId.putIfAbsent(node.getId(), node);
        }

        Set<String> component = reachableFrom(seedNodeId, edges);

        List<GraphNode> keptNodes = new ArrayList<>();
        for (String id : component) {
            GraphNode node = byId.get(id);
            if (node != null) {
                keptNodes.add(node);
            }
        }
        Set<String> keptIds = new LinkedHashSet<>();
        keptNodes.forEach(n -> keptIds.add(n.getId()));

        List<GraphEdge> keptEdges = edges.stream()
                .filter(e -> keptIds.contains(e.from()) && keptIds.contains(e.to()))
                .toList();

        int droppedNodes = byId.size() - keptNodes.size();
        if (droppedNodes > 0) {
            log.debug("Component of {} dropped {} unreachable node(s)", seedNodeId, droppedNodes);
        }
        return new OwnershipSubgraph(seedNodeId, keptNodes, keptEdges);
    }

    /**
     * Breadth-first search over the undirected view of {@code edges}.
     *
     * @return the visited ids in visiting order, the seed first
     */
    public Set<String> reachableFrom(String seedNodeId, List<GraphEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            adjacency.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge.from());
        }

        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(seedNodeId);
        queue.add(seedNodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        return visited;
    }
}
