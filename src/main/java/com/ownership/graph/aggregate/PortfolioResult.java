package com.ownership.graph.aggregate;

import com.ownership.graph.extract.OwnershipSubgraph;

import java.util.List;
import java.util.Objects;

/**
 * The portfolio connected to a seed property.
 *
 * @param properties      properties sorted by assessed value, highest first
 * @param people          people sorted by property count, highest first
 * @param entities        business entities sorted by property count, highest first
 * @param commonAddresses the most linked business addresses
 * @param graph           component size and crawl outcome
 * @param subgraph        the component itself
 */
public record PortfolioResult(
        List<PortfolioProperty> properties,
        List<OwnerSummary> people,
        List<OwnerSummary> entities,
        List<CommonAddress> commonAddresses,
        GraphStats graph,
        OwnershipSubgraph subgraph
) {
    public PortfolioResult {
        properties = properties != null ? List.copyOf(properties) : List.of();
        people = people != null ? List.copyOf(people) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
        commonAddresses = commonAddresses != null ? List.copyOf(commonAddresses) : List.of();
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(subgraph, "subgraph is required");
    }

    /**
     * True when the crawl found no contact, property or address linked to the seed.
     */
    public boolean isEmpty() {
        return properties.isEmpty() && people.isEmpty() && entities.isEmpty();
    }
}
