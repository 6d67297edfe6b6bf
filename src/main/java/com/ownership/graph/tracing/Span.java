package com.ownership.graph.tracing;

/**
 * A unit of work in a trace, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("ownership.crawl.round")) {
 *     span.setAttribute("round", round);
 *     // ... run the round ...
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
