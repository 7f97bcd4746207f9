package com.contact.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for structured logging. Entries are put on creation and removed on close:
 *
 * <pre>
 * try (LogContext ctx = LogContext.forToolCall(correlationId, "mail", "search")) {
 *     log.info("tool.dispatch tool={} action={}", "mail", "search");
 * }
 * </pre>
 *
 * <p>MDC is thread-bound; work continued on another thread (a completion
 * stage, the timeout scheduler) does not see these entries.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forToolCall(String correlationId, String tool, String action) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("tool", tool);
        if (action != null) {
            ctx.put("action", action);
        }
        ctx.put("operation", "tool");
        return ctx;
    }

    public static LogContext forCacheBuild(String buildId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("buildId", buildId);
        ctx.put("source", source);
        ctx.put("operation", "cache-build");
        return ctx;
    }

    public static LogContext forEnrichment(String label, int handleCount) {
        LogContext ctx = new LogContext();
        ctx.put("enrichmentLabel", label);
        ctx.put("handleCount", String.valueOf(handleCount));
        ctx.put("operation", "enrich");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
