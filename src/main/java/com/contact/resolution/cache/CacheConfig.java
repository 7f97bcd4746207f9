package com.contact.resolution.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the contact resolution cache.
 *
 * @param ttl how long a built contact index is reused before the next lookup rebuilds it
 */
public record CacheConfig(Duration ttl) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default configuration: 5 minute TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_TTL);
    }

    public static CacheConfig ofMillis(long ttlMillis) {
        return new CacheConfig(Duration.ofMillis(ttlMillis));
    }
}
