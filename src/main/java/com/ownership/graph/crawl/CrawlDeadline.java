package com.ownership.graph.crawl;

import java.time.Duration;
import java.util.Objects;

/**
 * Wall-clock budget for one crawl, checked at every round boundary and inside running lookups.
 */
public final class CrawlDeadline {

    private final Duration timeout;
    private final long deadlineNanos;

    private CrawlDeadline(Duration timeout) {
        this.timeout = timeout;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    /**
     * A deadline that expires {@code timeout} from now.
     */
    public static CrawlDeadline after(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return new CrawlDeadline(timeout);
    }

    public boolean isExpired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Milliseconds left, never negative.
     */
    public long remainingMillis() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining <= 0 ? 0 : Math.max(1, remaining / 1_000_000);
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "CrawlDeadline{timeout=" + timeout + ", remainingMillis=" + remainingMillis() + '}';
    }
}
