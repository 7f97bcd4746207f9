package com.contact.resolution.enrichment;

import com.contact.resolution.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeoutGuard Tests")
class TimeoutGuardTest {

    private SimpleMeterRegistry registry;
    private TimeoutGuard guard;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        guard = new TimeoutGuard(new MicrometerMetricsService(registry));
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    @DisplayName("Never-completing operation yields the fallback shortly after the timeout")
    void fallbackOnTimeout() throws Exception {
        CompletableFuture<Map<String, String>> never = new CompletableFuture<>();

        long start = System.nanoTime();
        Map<String, String> result = guard.withTimeout(() -> never, Duration.ofMillis(50), Map.of(), "test_enrichment")
                .get(2, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(Map.of(), result);
        assertTrue(elapsedMs >= 40, "returned before the timeout: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "fallback took " + elapsedMs + "ms");
        assertFalse(never.isDone(), "guard must not complete or cancel the operation");
        assertEquals(1.0, registry.find("contact.enrichment.timeout")
                .tag("label", "test_enrichment").counter().count());
    }

    @Test
    @DisplayName("Operation finishing first delivers its value")
    void valueWins() throws Exception {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> guarded = guard.withTimeout(() -> pending, Duration.ofSeconds(5), "fallback", "x");

        pending.complete("resolved");

        assertEquals("resolved", guarded.get(1, TimeUnit.SECONDS));
        assertNull(registry.find("contact.enrichment.timeout").counter());
    }

    @Test
    @DisplayName("Already completed operation is returned without waiting")
    void alreadyDone() {
        CompletableFuture<String> guarded = guard.withTimeout(
                () -> CompletableFuture.completedFuture("done"), Duration.ofMillis(1), "fallback", "x");

        assertEquals("done", guarded.join());
    }

    @Test
    @DisplayName("Operation failing first propagates its failure")
    void failurePropagates() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> guarded = guard.withTimeout(() -> pending, Duration.ofSeconds(5), "fallback", "x");

        pending.completeExceptionally(new IllegalStateException("source down"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> guarded.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("source down", error.getCause().getMessage());
    }

    @Test
    @DisplayName("Synchronous throw from the supplier becomes a failed future")
    void synchronousThrow() {
        CompletableFuture<String> guarded = guard.withTimeout(() -> {
            throw new IllegalArgumentException("bad input");
        }, Duration.ofSeconds(5), "fallback", "x");

        assertTrue(guarded.isCompletedExceptionally());
    }

    @Test
    @DisplayName("Late completion after the timeout does not change the result")
    void lateCompletionIgnored() throws Exception {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> guarded = guard.withTimeout(() -> pending, Duration.ofMillis(20), "fallback", null);

        assertEquals("fallback", guarded.get(2, TimeUnit.SECONDS));
        pending.complete("late");

        assertEquals("fallback", guarded.join());
        assertEquals(1.0, registry.find("contact.enrichment.timeout")
                .tag("label", "unlabelled").counter().count());
    }
}
