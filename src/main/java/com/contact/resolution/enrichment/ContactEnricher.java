package com.contact.resolution.enrichment;

import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Attaches contact names to the handles collected from a page of results.
 *
 * <p>Enrichment is best-effort: the result is an empty map whenever the batch
 * resolver is slow or fails, and callers fall back to the names they already have.</p>
 */
public class ContactEnricher {
    private static final Logger log = LoggerFactory.getLogger(ContactEnricher.class);

    private final HandleBatchResolver resolver;
    private final TimeoutGuard timeoutGuard;

    public ContactEnricher(HandleBatchResolver resolver, TimeoutGuard timeoutGuard) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.timeoutGuard = Objects.requireNonNull(timeoutGuard, "timeoutGuard is required");
    }

    /**
     * Resolves at most {@code maxHandles} distinct, non-blank handles in one batch.
     * Handles beyond the cap are left unresolved.
     *
     * @return resolved contacts keyed by raw handle; never fails
     */
    public CompletableFuture<Map<String, ContactSummary>> resolveNames(Collection<String> handles, int maxHandles,
                                                                       Duration timeout, String label) {
        List<String> batch = selectHandles(handles, maxHandles);
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        try (LogContext ctx = LogContext.forEnrichment(label, batch.size())) {
            log.debug("enrichment.started label={} handles={} dropped={}",
                    label, batch.size(), handles.size() - batch.size());
        }
        return timeoutGuard.withTimeout(() -> resolver.resolveBatch(batch), timeout, Map.of(), label)
                .exceptionally(error -> {
                    log.warn("enrichment.failed label={} error={}", label, Futures.unwrap(error).toString());
                    return Map.of();
                });
    }

    /**
     * Synchronous form of {@link #resolveNames} for tool handlers.
     */
    public Map<String, ContactSummary> resolveNamesNow(Collection<String> handles, int maxHandles,
                                                       Duration timeout, String label) {
        return Futures.join(resolveNames(handles, maxHandles, timeout, label));
    }

    static List<String> selectHandles(Collection<String> handles, int maxHandles) {
        if (handles == null || handles.isEmpty() || maxHandles <= 0) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String handle : handles) {
            if (distinct.size() >= maxHandles) {
                break;
            }
            if (handle != null && !handle.isBlank()) {
                distinct.add(handle);
            }
        }
        return new ArrayList<>(distinct);
    }
}
