package com.contact.resolution.metrics;

import com.contact.resolution.core.model.BuildOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code contact.cache.build} Timer (tag: outcome)</li>
 *   <li>{@code contact.cache.hit} / {@code contact.cache.miss} Counters</li>
 *   <li>{@code contact.enrichment.timeout} Counter (tag: label)</li>
 *   <li>{@code contact.search} Counter (tag: outcome)</li>
 *   <li>{@code contact.tool.duration} Timer (tags: tool, error)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("contact.cache.hit")
                .description("Handle lookups answered from the contact index")
                .register(registry);
        this.cacheMissCounter = Counter.builder("contact.cache.miss")
                .description("Handle lookups with no matching contact")
                .register(registry);
    }

    @Override
    public void recordCacheBuild(BuildOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("build:" + outcome.name(), k ->
                Timer.builder("contact.cache.build")
                        .description("Duration of contact index builds")
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordEnrichmentTimeout(String label) {
        counterCache.computeIfAbsent("timeout:" + label, k ->
                Counter.builder("contact.enrichment.timeout")
                        .description("Enrichment calls abandoned at their time budget")
                        .tag("label", label)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordNameSearch(String outcome) {
        counterCache.computeIfAbsent("search:" + outcome, k ->
                Counter.builder("contact.search")
                        .description("Targeted contact name searches")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordToolCall(String tool, boolean error, Duration duration) {
        String key = "tool:" + tool + ":" + error;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("contact.tool.duration")
                        .description("Duration of tool handler calls")
                        .tag("tool", tool)
                        .tag("error", String.valueOf(error))
                        .register(registry));
        timer.record(duration);
    }
}
