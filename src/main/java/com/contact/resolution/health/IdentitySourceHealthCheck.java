package com.contact.resolution.health;

import com.contact.resolution.cache.CacheStats;
import com.contact.resolution.cache.ContactResolutionCache;
import com.contact.resolution.core.model.BuildOutcome;

/**
 * Reports whether the last contact index build reached the identity source.
 * DEGRADED means names are currently not being resolved; the tools still work.
 */
public class IdentitySourceHealthCheck implements HealthCheck {

    private final ContactResolutionCache cache;

    public IdentitySourceHealthCheck(ContactResolutionCache cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "identitySource";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.stats();
        BuildOutcome outcome = stats.lastOutcome();

        HealthStatus base;
        if (outcome == null) {
            base = HealthStatus.up("Contact index not built yet");
        } else if (outcome == BuildOutcome.PERMISSION_DENIED) {
            base = HealthStatus.degraded("Contacts access denied; names will not be resolved");
        } else if (outcome == BuildOutcome.FAILED) {
            base = HealthStatus.degraded("Last contact index build failed");
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("cacheSize", stats.size())
                .withDetail("builds", stats.buildCount())
                .withDetail("hitRate", stats.hitRate())
                .withDetail("lastOutcome", outcome != null ? outcome.name() : "NONE");
    }
}
