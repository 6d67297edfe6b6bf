package com.ownership.graph.metrics;

import java.time.Duration;

/**
 * Interface for recording crawl metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCrawlDuration(Duration duration, boolean deadlineExceeded);

    void recordRoundsRun(int rounds);

    void recordFrontierSize(int size);

    void incrementLookupFailure(String lookup);

    void recordGraphSize(int nodeCount, int edgeCount);
}
