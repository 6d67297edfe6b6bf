package com.ownership.graph.source;

import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.core.model.Registration;

import java.util.List;

/**
 * Lookup of housing registrations.
 * Implementations return an empty list when nothing matches and throw
 * {@link DataSourceException} when the lookup itself fails.
 */
public interface RegistrationSource {

    /**
     * Registrations filed for the given property, most recent first.
     */
    List<Registration> findByProperty(PropertyId propertyId);

    /**
     * Registrations with the given ids, in any order. Unknown ids are skipped.
     */
    List<Registration> findByIds(List<String> registrationIds);

    /**
     * Provenance recorded on the edges built from this source.
     */
    default String sourceName() {
        return "HPD";
    }
}
