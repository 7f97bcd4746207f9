package com.contact.resolution.cache;

import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.BuildOutcome;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.core.model.HandleKind;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.rules.HandleNormalizer;
import com.contact.resolution.source.IdentitySource;
import com.contact.resolution.source.IdentitySourceException;
import com.contact.resolution.tracing.Span;
import com.contact.resolution.tracing.TracingService;
import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide handle-to-contact cache over an {@link IdentitySource}.
 *
 * <p>The whole address book is loaded in one bulk call and kept as a single
 * {@link ContactIndex} for the configured TTL. The index lives under one key of
 * a Caffeine {@link AsyncLoadingCache}: concurrent lookups on a cold or expired
 * cache share the same in-flight build, and a build that outlives the caller
 * waiting on it still lands in the cache for the next caller.</p>
 *
 * <p>Lookups never fail. A permission error or any other source failure
 * produces an empty index that counts as fresh, so the source is not retried
 * until the TTL elapses.</p>
 */
public class ContactResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(ContactResolutionCache.class);

    private static final String INDEX_KEY = "contacts";

    private final IdentitySource source;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AsyncLoadingCache<String, ContactIndex> cache;

    private final AtomicLong builds = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private volatile BuildOutcome lastOutcome;

    public ContactResolutionCache(IdentitySource source, CacheConfig config,
                                  MetricsService metricsService, TracingService tracingService,
                                  Ticker ticker) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        Objects.requireNonNull(config, "config is required");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.ttl())
                .ticker(ticker != null ? ticker : Ticker.systemTicker())
                .buildAsync((key, executor) -> buildIndex());
        log.info("ContactResolutionCache initialized: source={}, ttl={}ms",
                source.getName(), config.ttl().toMillis());
    }

    /**
     * Resolves one phone number or email address. Completes empty when the
     * handle is too short to be a phone and not email-shaped, when nothing
     * matches, or when the index could not be built.
     */
    public CompletableFuture<Optional<ContactSummary>> resolveHandle(String rawHandle) {
        if (HandleNormalizer.classify(rawHandle) == HandleKind.UNKNOWN) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return currentIndex()
                .thenApply(index -> record(index.lookup(rawHandle)))
                .exceptionally(error -> {
                    log.warn("cache.lookup.failed error={}", Futures.unwrap(error).toString());
                    return Optional.empty();
                });
    }

    /**
     * Resolves many handles against one index. The result is keyed by the raw
     * handle as given and holds only handles that matched.
     */
    public CompletableFuture<Map<String, ContactSummary>> resolveBatch(Iterable<String> rawHandles) {
        if (rawHandles == null || !rawHandles.iterator().hasNext()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        return currentIndex()
                .thenApply(index -> {
                    Map<String, ContactSummary> resolved = new LinkedHashMap<>();
                    for (String handle : rawHandles) {
                        if (handle == null || resolved.containsKey(handle)) {
                            continue;
                        }
                        record(index.lookup(handle)).ifPresent(summary -> resolved.put(handle, summary));
                    }
                    return Map.copyOf(resolved);
                })
                .exceptionally(error -> {
                    log.warn("cache.batch.failed error={}", Futures.unwrap(error).toString());
                    return Map.of();
                });
    }

    /**
     * Drops the index, including a build still in flight. The next lookup rebuilds.
     */
    public void invalidate() {
        cache.synchronous().invalidateAll();
        log.debug("cache.invalidated");
    }

    /**
     * Number of indexed keys, 0 when the cache is empty, invalidated or still building.
     */
    public int size() {
        CompletableFuture<ContactIndex> current = cache.getIfPresent(INDEX_KEY);
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return 0;
        }
        return current.join().size();
    }

    public CacheStats stats() {
        return new CacheStats(builds.get(), hits.get(), misses.get(), size(), lastOutcome);
    }

    public BuildOutcome getLastOutcome() {
        return lastOutcome;
    }

    private CompletableFuture<ContactIndex> currentIndex() {
        // dependent stage so a caller giving up never completes the shared build
        return cache.get(INDEX_KEY).thenApply(index -> index);
    }

    private Optional<ContactSummary> record(Optional<ContactSummary> result) {
        if (result.isPresent()) {
            hits.incrementAndGet();
            metricsService.recordCacheHit();
        } else {
            misses.incrementAndGet();
            metricsService.recordCacheMiss();
        }
        return result;
    }

    private CompletableFuture<ContactIndex> buildIndex() {
        builds.incrementAndGet();
        String buildId = LogContext.generateCorrelationId();
        long startNanos = System.nanoTime();
        Span span = tracingService.startSpan(TracingService.INDEX_BUILD,
                Map.of(TracingService.ATTR_SOURCE, source.getName()));

        try (LogContext ctx = LogContext.forCacheBuild(buildId, source.getName())) {
            log.info("cache.build.started buildId={}", buildId);
        }

        return Futures.call(source::fetchAllContacts)
                .handle((contacts, error) -> {
                    try {
                        ContactIndex index = toIndex(contacts, error, buildId);
                        span.setAttribute(TracingService.ATTR_KEYS, index.size());
                        span.setAttribute(TracingService.ATTR_OUTCOME, index.getOutcome().name());
                        span.setStatus(index.getOutcome() == BuildOutcome.LOADED
                                ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
                        lastOutcome = index.getOutcome();
                        metricsService.recordCacheBuild(index.getOutcome(),
                                Duration.ofNanos(System.nanoTime() - startNanos));
                        return index;
                    } finally {
                        span.close();
                    }
                });
    }

    private ContactIndex toIndex(List<Contact> contacts, Throwable error, String buildId) {
        Instant now = Instant.now();
        if (error != null) {
            Throwable cause = Futures.unwrap(error);
            if (cause instanceof IdentitySourceException sourceError && sourceError.isPermissionError()) {
                log.warn("cache.build.permission_denied buildId={} message={}", buildId, cause.getMessage());
                return ContactIndex.empty(BuildOutcome.PERMISSION_DENIED, now);
            }
            log.warn("cache.build.failed buildId={} error={}", buildId, cause.toString());
            return ContactIndex.empty(BuildOutcome.FAILED, now);
        }
        List<Contact> loaded = contacts != null ? contacts : List.of();
        ContactIndex index = ContactIndex.of(loaded, now);
        log.info("cache.build.completed buildId={} contacts={} keys={}", buildId, loaded.size(), index.size());
        return index;
    }
}
