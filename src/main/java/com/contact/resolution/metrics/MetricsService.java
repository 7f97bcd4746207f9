package com.contact.resolution.metrics;

import com.contact.resolution.core.model.BuildOutcome;

import java.time.Duration;

/**
 * Interface for recording contact resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordCacheBuild(BuildOutcome outcome, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    void recordEnrichmentTimeout(String label);

    /**
     * @param outcome one of {@code found}, {@code empty}, {@code permission_denied}, {@code timeout}, {@code error}
     */
    void recordNameSearch(String outcome);

    void recordToolCall(String tool, boolean error, Duration duration);
}
