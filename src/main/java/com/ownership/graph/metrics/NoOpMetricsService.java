package com.ownership.graph.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCrawlDuration(Duration duration, boolean deadlineExceeded) {
    }

    @Override
    public void recordRoundsRun(int rounds) {
    }

    @Override
    public void recordFrontierSize(int size) {
    }

    @Override
    public void incrementLookupFailure(String lookup) {
    }

    @Override
    public void recordGraphSize(int nodeCount, int edgeCount) {
    }
}
