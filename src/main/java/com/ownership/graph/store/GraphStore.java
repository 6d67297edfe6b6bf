package com.ownership.graph.store;

import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory node and edge set built during one crawl.
 *
 * <p>Nodes are keyed by id and inserted idempotently: re-inserting an id merges attributes.
 * Edges form a multigraph; the same pair may be linked any number of times. An edge can
 * only be added once both of its endpoints are present.</p>
 *
 * <p>All methods are safe to call from the lookups of one round running in parallel.
 * Once {@link #seal() sealed}, the store silently ignores further writes so that lookups
 * still in flight after a deadline cannot change a graph that is already being read.</p>
 */
public class GraphStore {
    private static final Logger log = LoggerFactory.getLogger(GraphStore.class);

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private boolean sealed;

    /**
     * Inserts the node, or merges its attributes into the node already stored under its id.
     *
     * @return the node as stored after the call
     */
    public synchronized GraphNode upsert(GraphNode node) {
        Objects.requireNonNull(node, "node is required");
        GraphNode existing = nodes.get(node.getId());
        if (sealed) {
            log.debug("Ignoring node {} written after the store was sealed", node.getId());
            return existing != null ? existing : node;
        }
        if (existing == null) {
            nodes.put(node.getId(), node);
            return node;
        }
        GraphNode merged = existing.mergedWith(node.getAttributes());
        if (merged != existing) {
            nodes.put(merged.getId(), merged);
        }
        return merged;
    }

    /**
     * Appends an edge. Duplicates are kept.
     *
     * @return false if the store is sealed and the edge was dropped
     * @throws IllegalStateException if either endpoint is not in the store
     */
    public synchronized boolean addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge is required");
        if (sealed) {
            log.debug("Ignoring edge {} -> {} written after the store was sealed", edge.from(), edge.to());
            return false;
        }
        if (!nodes.containsKey(edge.from())) {
            throw new IllegalStateException("Edge source node not found: " + edge.from());
        }
        if (!nodes.containsKey(edge.to())) {
            throw new IllegalStateException("Edge target node not found: " + edge.to());
        }
        edges.add(edge);
        return true;
    }

    public synchronized Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public synchronized boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Snapshot of the nodes in insertion order.
     */
    public synchronized List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * Snapshot of the edges in insertion order.
     */
    public synchronized List<GraphEdge> edges() {
        return List.copyOf(edges);
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }

    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }
}
