package com.ownership.graph.crawl;

import com.ownership.graph.core.model.PropertyId;

import java.util.Objects;

/**
 * A not-yet-processed unit of crawl work. Each task is consumed exactly once, in the round
 * after the one that discovered it.
 */
public sealed interface FrontierTask permits FrontierTask.PropertyTask, FrontierTask.NameTask {

    /**
     * Key in the matching visited set.
     */
    String key();

    /**
     * Find the contacts registered for a property.
     */
    record PropertyTask(PropertyId propertyId) implements FrontierTask {

        public PropertyTask {
            Objects.requireNonNull(propertyId, "propertyId is required");
        }

        @Override
        public String key() {
            return propertyId.key();
        }
    }

    /**
     * Find the properties and address-sharing contacts of a name.
     */
    record NameTask(String normalizedName) implements FrontierTask {

        public NameTask {
            Objects.requireNonNull(normalizedName, "normalizedName is required");
        }

        @Override
        public String key() {
            return normalizedName;
        }
    }
}
