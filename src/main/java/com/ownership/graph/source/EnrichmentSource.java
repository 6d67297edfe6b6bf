package com.ownership.graph.source;

import com.ownership.graph.core.model.PropertyEnrichment;
import com.ownership.graph.core.model.PropertyId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of tax lot and assessment details.
 */
public interface EnrichmentSource {

    /**
     * Batch lookup of properties that all lie in one borough.
     *
     * @return details keyed by property id; properties without a match are absent
     */
    Map<PropertyId, PropertyEnrichment> findByBorough(String boroCode, List<PropertyId> propertyIds);

    default Optional<PropertyEnrichment> find(PropertyId propertyId) {
        return Optional.ofNullable(findByBorough(propertyId.boroCode(), List.of(propertyId)).get(propertyId));
    }

    default String enrichmentSourceName() {
        return "PLUTO";
    }
}
