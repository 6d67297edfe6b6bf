package com.ownership.graph.aggregate;

/**
 * Size of the extracted component and how the crawl ended.
 */
public record GraphStats(int nodeCount, int edgeCount, int roundsRun, boolean deadlineExceeded) {
}
