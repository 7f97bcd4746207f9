package com.contact.resolution.tracing;

import java.util.Map;

/**
 * Default when no OpenTelemetry instance is configured. Cache builds and name
 * searches run exactly as traced ones do; their spans are dropped.
 */
public class NoOpTracingService implements TracingService {

    static final Span DISCARDING_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return DISCARDING_SPAN;
    }
}
