package com.contact.resolution.metrics;

import com.contact.resolution.core.model.BuildOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheBuild(BuildOutcome outcome, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordEnrichmentTimeout(String label) {
    }

    @Override
    public void recordNameSearch(String outcome) {
    }

    @Override
    public void recordToolCall(String tool, boolean error, Duration duration) {
    }
}
