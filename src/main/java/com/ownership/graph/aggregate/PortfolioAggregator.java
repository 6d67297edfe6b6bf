package com.ownership.graph.aggregate;

import com.ownership.graph.api.CrawlOptions;
import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;
import com.ownership.graph.core.model.PropertyEnrichment;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.crawl.LookupGuard;
import com.ownership.graph.extract.OwnershipSubgraph;
import com.ownership.graph.logging.LogContext;
import com.ownership.graph.source.EnrichmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Turns an extracted component into a portfolio: enriched properties,
 * the people and entities behind them, and their most shared mailing addresses.
 */
public class PortfolioAggregator {
    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    private static final Comparator<PortfolioProperty> BY_ASSESSED_VALUE =
            Comparator.comparingLong(PortfolioProperty::assessedValue).reversed()
                    .thenComparing(PortfolioProperty::bbl);

    private static final Comparator<OwnerSummary> BY_PROPERTY_COUNT =
            Comparator.comparingInt(OwnerSummary::propertyCount).reversed()
                    .thenComparing(OwnerSummary::name);

    private static final Comparator<CommonAddress> BY_COUNT =
            Comparator.comparingInt(CommonAddress::count).reversed()
                    .thenComparing(CommonAddress::address);

    private final EnrichmentSource enrichmentSource;
    private final CrawlOptions options;
    private final ExecutorService executor;
    private final LookupGuard lookupGuard;

    public PortfolioAggregator(EnrichmentSource enrichmentSource, CrawlOptions options,
                               ExecutorService executor, LookupGuard lookupGuard) {
        this.enrichmentSource = Objects.requireNonNull(enrichmentSource, "enrichmentSource is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.lookupGuard = Objects.requireNonNull(lookupGuard, "lookupGuard is required");
    }

    public PortfolioResult aggregate(OwnershipSubgraph subgraph, int roundsRun, boolean deadlineExceeded) {
        GraphStats stats = new GraphStats(subgraph.nodeCount(), subgraph.edgeCount(), roundsRun, deadlineExceeded);
        if (subgraph.edgeCount() == 0) {
            return new PortfolioResult(List.of(), List.of(), List.of(), List.of(), stats, subgraph);
        }

        Map<String, GraphNode> nodesById = subgraph.nodesById();
        Map<String, List<GraphEdge>> incident = incidentEdges(subgraph.edges());

        List<GraphNode> propertyNodes = subgraph.nodesOfKind(NodeKind.PROPERTY);
        Map<PropertyId, PropertyEnrichment> enrichment = fetchEnrichment(propertyNodes);

        List<PortfolioProperty> properties = new ArrayList<>();
        for (GraphNode node : propertyNodes) {
            PropertyId id = propertyId(node);
            PropertyEnrichment details = enrichment.getOrDefault(id, PropertyEnrichment.EMPTY);
            properties.add(toPortfolioProperty(node, id, details,
                    connectedVia(node.getId(), incident, nodesById)));
        }
        properties.sort(BY_ASSESSED_VALUE);

        List<OwnerSummary> people = summarize(subgraph.nodesOfKind(NodeKind.PERSON), incident, nodesById);
        List<OwnerSummary> entities = summarize(subgraph.nodesOfKind(NodeKind.ENTITY), incident, nodesById);

        List<CommonAddress> commonAddresses = new ArrayList<>();
        for (GraphNode address : subgraph.nodesOfKind(NodeKind.ADDRESS)) {
            int count = incident.getOrDefault(address.getId(), List.of()).size();
            commonAddresses.add(new CommonAddress(address.getLabel(), count));
        }
        commonAddresses.sort(BY_COUNT);
        if (commonAddresses.size() > options.getMaxCommonAddresses()) {
            commonAddresses = commonAddresses.subList(0, options.getMaxCommonAddresses());
        }

        log.debug("Aggregated portfolio: properties={}, people={}, entities={}, enriched={}",
                properties.size(), people.size(), entities.size(), enrichment.size());
        return new PortfolioResult(properties, people, entities, commonAddresses, stats, subgraph);
    }

    private Map<PropertyId, PropertyEnrichment> fetchEnrichment(List<GraphNode> propertyNodes) {
        Map<String, List<PropertyId>> byBorough = new LinkedHashMap<>();
        for (GraphNode node : propertyNodes) {
            PropertyId id = propertyId(node);
            byBorough.computeIfAbsent(id.boroCode(), k -> new ArrayList<>()).add(id);
        }

        int batchSize = options.getEnrichmentBatchSize();
        List<CompletableFuture<Map<PropertyId, PropertyEnrichment>>> futures = new ArrayList<>();
        for (Map.Entry<String, List<PropertyId>> entry : byBorough.entrySet()) {
            List<PropertyId> ids = entry.getValue();
            for (int from = 0; from < ids.size(); from += batchSize) {
                List<PropertyId> chunk = List.copyOf(ids.subList(from, Math.min(from + batchSize, ids.size())));
                String boroCode = entry.getKey();
                futures.add(CompletableFuture.supplyAsync(LogContext.propagate(() -> lookupGuard.call(
                        "enrichment.byBorough",
                        () -> enrichmentSource.findByBorough(boroCode, chunk),
                        Map.<PropertyId, PropertyEnrichment>of())), executor));
            }
        }

        Map<PropertyId, PropertyEnrichment> merged = new HashMap<>();
        for (CompletableFuture<Map<PropertyId, PropertyEnrichment>> future : futures) {
            merged.putAll(future.join());
        }
        return merged;
    }

    private PortfolioProperty toPortfolioProperty(GraphNode node, PropertyId id, PropertyEnrichment details,
                                                  List<String> connectedVia) {
        String address = !details.address().isBlank()
                ? details.address()
                : node.attribute(GraphNode.ATTR_STREET_ADDRESS);
        return new PortfolioProperty(
                id.bbl(),
                address,
                Boroughs.name(id.boroCode()),
                id.boroCode(),
                id.block(),
                id.lot(),
                details.units(),
                details.yearBuilt(),
                details.assessedValue(),
                details.floors(),
                details.buildingArea(),
                details.zoning(),
                details.ownerName(),
                connectedVia);
    }

    private List<String> connectedVia(String nodeId, Map<String, List<GraphEdge>> incident,
                                      Map<String, GraphNode> nodesById) {
        Set<String> labels = new LinkedHashSet<>();
        for (GraphEdge edge : incident.getOrDefault(nodeId, List.of())) {
            if (labels.size() >= options.getConnectedViaLimit()) {
                break;
            }
            GraphNode other = nodesById.get(edge.otherEnd(nodeId));
            if (other != null) {
                labels.add(other.getLabel());
            }
        }
        return new ArrayList<>(labels);
    }

    private List<OwnerSummary> summarize(List<GraphNode> owners, Map<String, List<GraphEdge>> incident,
                                         Map<String, GraphNode> nodesById) {
        List<OwnerSummary> summaries = new ArrayList<>();
        for (GraphNode owner : owners) {
            Set<String> roles = new LinkedHashSet<>();
            Set<String> addresses = new LinkedHashSet<>();
            int propertyCount = 0;
            for (GraphEdge edge : incident.getOrDefault(owner.getId(), List.of())) {
                roles.add(edge.role());
                GraphNode other = nodesById.get(edge.otherEnd(owner.getId()));
                if (other == null) {
                    continue;
                }
                if (other.getKind() == NodeKind.PROPERTY) {
                    propertyCount++;
                } else if (other.getKind() == NodeKind.ADDRESS) {
                    addresses.add(other.getLabel());
                }
            }
            summaries.add(new OwnerSummary(owner.getLabel(), owner.getKind(),
                    new ArrayList<>(roles), new ArrayList<>(addresses), propertyCount));
        }
        summaries.sort(BY_PROPERTY_COUNT);
        return summaries;
    }

    private static Map<String, List<GraphEdge>> incidentEdges(List<GraphEdge> edges) {
        Map<String, List<GraphEdge>> incident = new HashMap<>();
        for (GraphEdge edge : edges) {
            incident.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            if (!edge.to().equals(edge.from())) {
                incident.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
            }
        }
        return incident;
    }

    private static PropertyId propertyId(GraphNode node) {
        String boroCode = node.attribute(GraphNode.ATTR_BORO_CODE);
        if (!boroCode.isEmpty()) {
            return PropertyId.of(boroCode, node.attribute(GraphNode.ATTR_BLOCK), node.attribute(GraphNode.ATTR_LOT));
        }
        return PropertyId.parse(node.getLabel());
    }
}
