package com.contact.resolution.cache;

import com.contact.resolution.core.model.BuildOutcome;

/**
 * Cache diagnostics.
 *
 * @param buildCount  number of index builds started
 * @param hitCount    handle lookups that found a contact
 * @param missCount   handle lookups that found nothing
 * @param size        indexed keys in the current index, 0 when empty or building
 * @param lastOutcome outcome of the most recent finished build, {@code null} before the first one
 */
public record CacheStats(long buildCount, long hitCount, long missCount, int size, BuildOutcome lastOutcome) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, null);
    }
}
