package com.ownership.graph.crawl;

import com.ownership.graph.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs external lookups so that a failure degrades to "no data from this branch".
 * A call is attempted up to {@code maxAttempts} times; when every attempt throws,
 * the failure is logged and counted and the fallback value is returned.
 */
public class LookupGuard {
    private static final Logger log = LoggerFactory.getLogger(LookupGuard.class);

    private final int maxAttempts;
    private final MetricsService metricsService;

    public LookupGuard(int maxAttempts, MetricsService metricsService) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * @param lookup   name of the lookup, used in logs and as the failure metric tag
     * @param call     the lookup
     * @param fallback returned when every attempt fails or the lookup returns null
     */
    public <T> T call(String lookup, Supplier<T> call, T fallback) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                T result = call.get();
                return result != null ? result : fallback;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.debug("Lookup {} attempt {}/{} failed: {}", lookup, attempt, maxAttempts, e.getMessage());
            }
        }
        if (lastFailure != null) {
            log.warn("Lookup {} failed, continuing without its data: {}", lookup, lastFailure.getMessage());
        } else {
            log.warn("Lookup {} skipped, thread interrupted", lookup);
        }
        metricsService.incrementLookupFailure(lookup);
        return fallback;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
