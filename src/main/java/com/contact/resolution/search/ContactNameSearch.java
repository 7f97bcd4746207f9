package com.contact.resolution.search;

import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.rules.HandleNormalizer;
import com.contact.resolution.source.IdentitySource;
import com.contact.resolution.source.IdentitySourceException;
import com.contact.resolution.tracing.Span;
import com.contact.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a person's name to every phone number and email address on file,
 * for filtering mail and messages by contact.
 *
 * <p>Each call issues one fresh name query to the identity source. Results
 * are not cached and the bulk contact index is neither read nor built.</p>
 */
public class ContactNameSearch {
    private static final Logger log = LoggerFactory.getLogger(ContactNameSearch.class);

    private final IdentitySource source;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public ContactNameSearch(IdentitySource source, MetricsService metricsService, TracingService tracingService) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
    }

    /**
     * Finds the normalized, de-duplicated handles of every contact matching {@code name}.
     *
     * @return empty when the name is blank, nothing matched, no match has a
     * handle, or the source denied access; fails with
     * {@link ContactSearchException} on any other source failure
     */
    public CompletableFuture<Optional<ContactHandles>> resolveNameToHandles(String name) {
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String query = name.trim();
        Span span = tracingService.startSpan(TracingService.NAME_SEARCH,
                Map.of(TracingService.ATTR_SOURCE, source.getName()));

        return Futures.call(() -> source.searchContactsByName(query))
                .handle((contacts, error) -> {
                    try {
                        if (error != null) {
                            span.recordException(Futures.unwrap(error));
                            span.setStatus(Span.SpanStatus.ERROR);
                            return handleFailure(query, Futures.unwrap(error));
                        }
                        Optional<ContactHandles> handles = collectHandles(contacts);
                        span.setAttribute(TracingService.ATTR_MATCHES, contacts != null ? contacts.size() : 0);
                        span.setStatus(Span.SpanStatus.OK);
                        metricsService.recordNameSearch(handles.isPresent() ? "found" : "empty");
                        log.debug("contact.search.completed matches={} handles={}",
                                contacts != null ? contacts.size() : 0,
                                handles.map(ContactHandles::size).orElse(0));
                        return handles;
                    } finally {
                        span.close();
                    }
                });
    }

    private Optional<ContactHandles> handleFailure(String query, Throwable cause) {
        if (cause instanceof IdentitySourceException sourceError && sourceError.isPermissionError()) {
            metricsService.recordNameSearch("permission_denied");
            log.warn("contact.search.permission_denied message={}", cause.getMessage());
            return Optional.empty();
        }
        boolean timeout = cause instanceof IdentitySourceException sourceError
                ? sourceError.isTimeout()
                : IdentitySourceException.looksLikeTimeout(cause.getMessage());
        metricsService.recordNameSearch(timeout ? "timeout" : "error");
        log.warn("contact.search.failed timeout={} error={}", timeout, cause.toString());
        throw new ContactSearchException("Contact search for '" + query + "' failed: " + cause.getMessage(),
                timeout, cause);
    }

    private static Optional<ContactHandles> collectHandles(List<Contact> contacts) {
        if (contacts == null || contacts.isEmpty()) {
            return Optional.empty();
        }
        Set<String> phones = new LinkedHashSet<>();
        Set<String> emails = new LinkedHashSet<>();
        for (Contact contact : contacts) {
            contact.phones().stream()
                    .map(HandleNormalizer::normalizePhone)
                    .filter(p -> !p.isEmpty())
                    .forEach(phones::add);
            contact.emails().stream()
                    .map(HandleNormalizer::normalizeEmail)
                    .filter(e -> !e.isEmpty())
                    .forEach(emails::add);
        }
        ContactHandles handles = new ContactHandles(List.copyOf(phones), List.copyOf(emails));
        return handles.isEmpty() ? Optional.empty() : Optional.of(handles);
    }
}
