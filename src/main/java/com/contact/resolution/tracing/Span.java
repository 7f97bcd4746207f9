package com.contact.resolution.tracing;

/**
 * A traced cache build or name search.
 *
 * <p>Spans are opened when the identity source is called and closed when its
 * future settles, not when the calling method returns:</p>
 *
 * <pre>
 * Span span = tracingService.startSpan(TracingService.NAME_SEARCH,
 *         Map.of(TracingService.ATTR_SOURCE, source.getName()));
 * return source.searchContactsByName(query).handle((contacts, error) -&gt; {
 *     try {
 *         span.setAttribute(TracingService.ATTR_MATCHES, contacts.size());
 *         ...
 *     } finally {
 *         span.close();
 *     }
 * });
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    /**
     * Attaches a failure from a name search. Cache builds never fail, so they
     * report failures through the outcome attribute instead.
     */
    void recordException(Throwable t);

    /**
     * Ends the span. Must be called exactly once, from whichever thread
     * completes the source future.
     */
    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
