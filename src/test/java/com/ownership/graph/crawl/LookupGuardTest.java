package com.ownership.graph.crawl;

import com.ownership.graph.metrics.MetricsService;
import com.ownership.graph.source.DataSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("LookupGuard Tests")
class LookupGuardTest {

    private final MetricsService metrics = mock(MetricsService.class);

    @Test
    @DisplayName("Should return the lookup result on success")
    void success() {
        LookupGuard guard = new LookupGuard(1, metrics);

        assertEquals(List.of("a"), guard.call("test", () -> List.of("a"), List.of()));
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Should return the fallback and count the failure")
    void fallbackOnFailure() {
        LookupGuard guard = new LookupGuard(1, metrics);

        List<String> result = guard.call("contacts.byName", () -> {
            throw new DataSourceException("boom");
        }, List.of());

        assertTrue(result.isEmpty());
        verify(metrics).incrementLookupFailure("contacts.byName");
    }

    @Test
    @DisplayName("Should retry up to maxAttempts before giving up")
    void retries() {
        LookupGuard guard = new LookupGuard(3, metrics);
        AtomicInteger attempts = new AtomicInteger();

        String result = guard.call("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "ok";
        }, "fallback");

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("A single attempt should not retry")
    void singleAttempt() {
        LookupGuard guard = new LookupGuard(1, metrics);
        AtomicInteger attempts = new AtomicInteger();

        guard.call("once", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("fail");
        }, "fallback");

        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("A null result should be replaced by the fallback")
    void nullResult() {
        LookupGuard guard = new LookupGuard(1, metrics);

        assertEquals(List.of(), guard.call("nulls", () -> null, List.of()));
    }

    @Test
    @DisplayName("Should reject non-positive attempts")
    void invalidAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new LookupGuard(0, metrics));
    }
}
