package com.contact.resolution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} on top of the OpenTelemetry API.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Spans are internal: they cover in-process work such as index builds and
 * name searches, not remote calls.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_SCOPE = "com.contact.resolution";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new SpanHandle(builder.startSpan());
    }

    private record SpanHandle(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
