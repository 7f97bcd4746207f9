package com.contact.resolution.enrichment;

import com.contact.resolution.core.Futures;
import com.contact.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds how long a caller waits for best-effort work.
 *
 * <p>{@link #withTimeout} races an operation against a timer. Whichever
 * finishes first decides the result; the operation itself is left running and
 * is never cancelled, so shared work (such as a contact index build) can still
 * complete for later callers.</p>
 */
public class TimeoutGuard implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final MetricsService metricsService;
    private final ScheduledExecutorService scheduler;

    public TimeoutGuard(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "contact-timeout-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs {@code operation} and completes with its value or failure if it
     * finishes within {@code timeout}; otherwise completes with {@code fallback}
     * and logs an {@code enrichment.timeout} warning.
     *
     * @param label names the call site in the timeout log and metric
     */
    public <T> CompletableFuture<T> withTimeout(Supplier<CompletableFuture<T>> operation, Duration timeout,
                                                T fallback, String label) {
        Objects.requireNonNull(timeout, "timeout is required");
        CompletableFuture<T> source = Futures.call(operation);
        if (source.isDone()) {
            return source.thenApply(value -> value);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (result.complete(fallback)) {
                log.warn("enrichment.timeout label={} timeoutMs={}", label, timeout.toMillis());
                metricsService.recordEnrichmentTimeout(label != null ? label : "unlabelled");
            }
        }, Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);

        source.whenComplete((value, error) -> {
            timer.cancel(false);
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
