package com.ownership.graph.extract;

import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;
import com.ownership.graph.core.model.PropertyId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComponentExtractor Tests")
class ComponentExtractorTest {

    private final ComponentExtractor extractor = new ComponentExtractor();

    private final GraphNode seed = GraphNode.property(PropertyId.of("1", "100", "1"));
    private final GraphNode owner = named(NodeKind.ENTITY, "ABC REALTY LLC");
    private final GraphNode address = named(NodeKind.ADDRESS, "123 MAIN ST NEW YORK NY 10001");
    private final GraphNode other = GraphNode.property(PropertyId.of("2", "200", "2"));
    private final GraphNode strangerOwner = named(NodeKind.PERSON, "JOHN STRANGER");
    private final GraphNode strangerProperty = GraphNode.property(PropertyId.of("3", "300", "3"));

    private static GraphNode named(NodeKind kind, String label) {
        return GraphNode.builder().kind(kind).label(label).build();
    }

    private static GraphEdge edge(GraphNode from, GraphNode to, String role) {
        return new GraphEdge(from.getId(), to.getId(), "HPD", role);
    }

    @Test
    @DisplayName("Should keep only the component reachable from the seed")
    void excludesDisconnectedCluster() {
        List<GraphEdge> edges = List.of(
                edge(owner, seed, "Head Officer"),
                edge(owner, address, GraphEdge.ROLE_BUSINESS_ADDRESS),
                edge(owner, other, GraphEdge.ROLE_REGISTRATION),
                edge(strangerOwner, strangerProperty, "Owner"));

        OwnershipSubgraph subgraph = extractor.extract(seed.getId(),
                List.of(seed, owner, address, other, strangerOwner, strangerProperty), edges);

        Set<String> ids = subgraph.nodes().stream().map(GraphNode::getId).collect(Collectors.toSet());
        assertEquals(Set.of(seed.getId(), owner.getId(), address.getId(), other.getId()), ids);
        assertEquals(3, subgraph.edgeCount());
        assertTrue(subgraph.edges().stream().noneMatch(e -> e.touches(strangerOwner.getId())));
    }

    @Test
    @DisplayName("Should ignore edge direction")
    void undirected() {
        List<GraphEdge> edges = List.of(
                edge(owner, seed, "Head Officer"),
                edge(other, address, GraphEdge.ROLE_SHARED_BUSINESS_ADDRESS),
                edge(owner, address, GraphEdge.ROLE_BUSINESS_ADDRESS));

        Set<String> reachable = extractor.reachableFrom(seed.getId(), edges);

        assertEquals(List.of(seed.getId(), owner.getId(), address.getId(), other.getId()), List.copyOf(reachable));
    }

    @Test
    @DisplayName("An isolated seed should be kept alone")
    void isolatedSeed() {
        OwnershipSubgraph subgraph = extractor.extract(seed.getId(), List.of(seed, strangerOwner, strangerProperty),
                List.of(edge(strangerOwner, strangerProperty, "Owner")));

        assertEquals(1, subgraph.nodeCount());
        assertEquals(seed, subgraph.nodes().get(0));
        assertEquals(0, subgraph.edgeCount());
    }

    @Test
    @DisplayName("Subgraph helpers should filter by kind and touching edges")
    void subgraphHelpers() {
        List<GraphEdge> edges = List.of(
                edge(owner, seed, "Head Officer"),
                edge(owner, address, GraphEdge.ROLE_BUSINESS_ADDRESS));
        OwnershipSubgraph subgraph = extractor.extract(seed.getId(), List.of(seed, owner, address), edges);

        assertEquals(List.of(seed), subgraph.nodesOfKind(NodeKind.PROPERTY));
        assertEquals(2, subgraph.edgesTouching(owner.getId()).size());
        assertEquals(owner, subgraph.node(owner.getId()).orElseThrow());
        assertTrue(subgraph.node("entity:NOBODY").isEmpty());
    }
}
