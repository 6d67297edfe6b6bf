package com.ownership.graph.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code ownership.crawl.duration} - Timer (tag: deadlineExceeded)</li>
 *   <li>{@code ownership.crawl.rounds} - DistributionSummary</li>
 *   <li>{@code ownership.crawl.frontier} - DistributionSummary</li>
 *   <li>{@code ownership.lookup.failures} - Counter (tag: lookup)</li>
 *   <li>{@code ownership.graph.nodes} - DistributionSummary</li>
 *   <li>{@code ownership.graph.edges} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Timer completedTimer;
    private final Timer timedOutTimer;
    private final DistributionSummary roundsSummary;
    private final DistributionSummary frontierSummary;
    private final DistributionSummary nodesSummary;
    private final DistributionSummary edgesSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.completedTimer = crawlTimer(false);
        this.timedOutTimer = crawlTimer(true);
        this.roundsSummary = DistributionSummary.builder("ownership.crawl.rounds")
                .description("Rounds run per crawl")
                .register(registry);
        this.frontierSummary = DistributionSummary.builder("ownership.crawl.frontier")
                .description("Frontier size at the start of each round")
                .register(registry);
        this.nodesSummary = DistributionSummary.builder("ownership.graph.nodes")
                .description("Nodes in the extracted ownership component")
                .register(registry);
        this.edgesSummary = DistributionSummary.builder("ownership.graph.edges")
                .description("Edges in the extracted ownership component")
                .register(registry);
    }

    private Timer crawlTimer(boolean deadlineExceeded) {
        return Timer.builder("ownership.crawl.duration")
                .description("Duration of ownership graph crawls")
                .tag("deadlineExceeded", String.valueOf(deadlineExceeded))
                .register(registry);
    }

    @Override
    public void recordCrawlDuration(Duration duration, boolean deadlineExceeded) {
        (deadlineExceeded ? timedOutTimer : completedTimer).record(duration);
    }

    @Override
    public void recordRoundsRun(int rounds) {
        roundsSummary.record(rounds);
    }

    @Override
    public void recordFrontierSize(int size) {
        frontierSummary.record(size);
    }

    @Override
    public void incrementLookupFailure(String lookup) {
        Counter counter = failureCounters.computeIfAbsent(lookup, k ->
                Counter.builder("ownership.lookup.failures")
                        .description("External lookups that failed and were skipped")
                        .tag("lookup", lookup)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordGraphSize(int nodeCount, int edgeCount) {
        nodesSummary.record(nodeCount);
        edgesSummary.record(edgeCount);
    }
}
