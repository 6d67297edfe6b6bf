package com.ownership.graph.crawl;

import com.ownership.graph.store.GraphStore;

import java.util.Objects;

/**
 * The raw graph a crawl produced, before component extraction.
 *
 * @param store            nodes and edges discovered
 * @param seedNodeId       id of the seed property node
 * @param roundsRun        rounds started
 * @param deadlineExceeded true if the crawl stopped because its deadline passed
 */
public record CrawlResult(GraphStore store, String seedNodeId, int roundsRun, boolean deadlineExceeded) {

    public CrawlResult {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(seedNodeId, "seedNodeId is required");
    }
}
