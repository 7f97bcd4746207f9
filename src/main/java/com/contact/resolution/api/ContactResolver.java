package com.contact.resolution.api;

import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.cache.CacheStats;
import com.contact.resolution.cache.ContactResolutionCache;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.enrichment.ContactEnricher;
import com.contact.resolution.enrichment.TimeoutGuard;
import com.contact.resolution.health.HealthCheckRegistry;
import com.contact.resolution.health.HealthStatus;
import com.contact.resolution.health.IdentitySourceHealthCheck;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.search.ContactNameSearch;
import com.contact.resolution.source.IdentitySource;
import com.contact.resolution.tracing.NoOpTracingService;
import com.contact.resolution.tracing.TracingService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point for contact resolution. Build one per process and share it
 * with every tool handler; its value is amortizing the bulk address book
 * fetch across requests.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ContactResolver resolver = ContactResolver.builder()
 *     .identitySource(new AutomationIdentitySource(executor))
 *     .cacheConfig(CacheConfig.ofMillis(300_000))
 *     .build();
 *
 * Optional&lt;ContactSummary&gt; who = resolver.resolveHandle("+1 (212) 555-1234").join();
 * Map&lt;String, ContactSummary&gt; names = resolver.resolveBatch(List.of("a@example.com", "2125551234")).join();
 * </pre>
 *
 * <p>{@link #resolveHandle}, {@link #resolveBatch}, {@link #invalidateCache} and
 * {@link #getCacheSize} never fail. {@link #resolveNameToHandles} fails with
 * {@link com.contact.resolution.search.ContactSearchException} when the search
 * itself breaks.</p>
 */
public class ContactResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactResolver.class);

    private final ContactResolutionCache cache;
    private final ContactNameSearch nameSearch;
    private final TimeoutGuard timeoutGuard;
    private final ContactEnricher enricher;
    private final MetricsService metricsService;
    private final HealthCheckRegistry healthCheckRegistry;

    private ContactResolver(Builder builder) {
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        CacheConfig cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();

        this.cache = new ContactResolutionCache(builder.identitySource, cacheConfig,
                metricsService, tracingService, builder.ticker);
        this.nameSearch = new ContactNameSearch(builder.identitySource, metricsService, tracingService);
        this.timeoutGuard = new TimeoutGuard(metricsService);
        this.enricher = new ContactEnricher(cache::resolveBatch, timeoutGuard);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new IdentitySourceHealthCheck(cache));

        log.info("ContactResolver initialized: source={}, ttl={}ms",
                builder.identitySource.getName(), cacheConfig.ttl().toMillis());
    }

    public CompletableFuture<Optional<ContactSummary>> resolveHandle(String rawHandle) {
        return cache.resolveHandle(rawHandle);
    }

    public CompletableFuture<Map<String, ContactSummary>> resolveBatch(Iterable<String> rawHandles) {
        return cache.resolveBatch(rawHandles);
    }

    public CompletableFuture<Optional<ContactHandles>> resolveNameToHandles(String name) {
        return nameSearch.resolveNameToHandles(name);
    }

    /**
     * Forces the next lookup to rebuild the contact index. Call after any
     * contact mutation.
     */
    public void invalidateCache() {
        cache.invalidate();
    }

    public int getCacheSize() {
        return cache.size();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    /**
     * Enricher bound to this resolver's cache, for tool handlers.
     */
    public ContactEnricher enricher() {
        return enricher;
    }

    public TimeoutGuard timeoutGuard() {
        return timeoutGuard;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    @Override
    public void close() {
        timeoutGuard.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IdentitySource identitySource;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Ticker ticker;

        public Builder identitySource(IdentitySource identitySource) {
            this.identitySource = identitySource;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Time source for cache expiry. Defaults to the system ticker.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public ContactResolver build() {
            if (identitySource == null) {
                throw new IllegalStateException("IdentitySource is required");
            }
            return new ContactResolver(this);
        }
    }
}
