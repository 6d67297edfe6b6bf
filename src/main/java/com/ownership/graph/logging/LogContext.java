package com.ownership.graph.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * AutoCloseable MDC wrapper for structured crawl logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCrawl(correlationId, seed.key())) {
 *     log.info("crawl.started maxDepth={}", maxDepth);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String SEED = "seed";
    public static final String OPERATION = "operation";
    public static final String ROUND = "round";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one ownership crawl, keyed by the seed BBL.
     */
    public static LogContext forCrawl(String correlationId, String seedKey) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(SEED, seedKey);
        ctx.put(OPERATION, "crawl");
        return ctx;
    }

    /**
     * Context for one round; nested inside a crawl context.
     */
    public static LogContext forRound(int round) {
        LogContext ctx = new LogContext();
        ctx.put(ROUND, String.valueOf(round));
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Captures the calling thread's MDC and returns a supplier that runs {@code work}
     * with it installed, restoring the worker thread's own MDC afterwards.
     */
    public static <T> Supplier<T> propagate(Supplier<T> work) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return work.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
