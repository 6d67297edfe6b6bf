package com.ownership.graph.tracing;

import com.ownership.graph.core.model.PropertyId;

import java.util.Map;

/**
 * Tracing hook for crawls: one span per crawl and one per round.
 * The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    String CRAWL_SPAN = "ownership.crawl";
    String ROUND_SPAN = "ownership.crawl.round";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startCrawlSpan(PropertyId seed, int maxDepth) {
        return startSpan(CRAWL_SPAN, Map.of("seed", seed.key(), "maxDepth", String.valueOf(maxDepth)));
    }

    default Span startRoundSpan(int round, int frontierSize) {
        return startSpan(ROUND_SPAN, Map.of("round", String.valueOf(round), "frontier", String.valueOf(frontierSize)));
    }
}
