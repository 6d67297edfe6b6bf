package com.ownership.graph.crawl;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Visited sets of one crawl. Discarded when the crawl ends.
 */
class CrawlState {

    private final Set<String> visitedProperties = ConcurrentHashMap.newKeySet();
    private final Set<String> visitedRegistrations = ConcurrentHashMap.newKeySet();
    private final Set<String> visitedNames = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the property was not visited before this call
     */
    boolean markProperty(String bblKey) {
        return visitedProperties.add(bblKey);
    }

    boolean markRegistration(String registrationId) {
        return visitedRegistrations.add(registrationId);
    }

    boolean isRegistrationVisited(String registrationId) {
        return visitedRegistrations.contains(registrationId);
    }

    boolean markName(String normalizedName) {
        return visitedNames.add(normalizedName);
    }

    /**
     * Marks the task's key in the matching set.
     *
     * @return true if the task is new and belongs in the next frontier
     */
    boolean accept(FrontierTask task) {
        if (task instanceof FrontierTask.PropertyTask propertyTask) {
            return markProperty(propertyTask.key());
        }
        return markName(task.key());
    }

    int visitedPropertyCount() {
        return visitedProperties.size();
    }

    int visitedRegistrationCount() {
        return visitedRegistrations.size();
    }

    int visitedNameCount() {
        return visitedNames.size();
    }
}
