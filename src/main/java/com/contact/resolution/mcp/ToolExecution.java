package com.contact.resolution.mcp;

import com.contact.resolution.core.Futures;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.search.ContactSearchException;
import com.contact.resolution.source.AutomationException;
import com.contact.resolution.source.IdentitySourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Runs a tool handler body and turns any failure into an error result.
 *
 * <p>Error messages read {@code "Failed to <operation>: <detail>"}. Invalid
 * arguments are reported with their own message. Automation failures with a
 * recognisable cause (timeout, lost connection, app not running) get a hint
 * instead of the raw error text. Stack traces are never returned.</p>
 */
public class ToolExecution {
    private static final Logger log = LoggerFactory.getLogger(ToolExecution.class);

    private static final String CONTACTS_APP = "Contacts";
    private static final Pattern LOST_CONNECTION = Pattern.compile("connection (is )?invalid", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_RUNNING = Pattern.compile("not running|can.t get application", Pattern.CASE_INSENSITIVE);

    private final MetricsService metricsService;

    public ToolExecution(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public Map<String, Object> run(String tool, String action, String operation, Supplier<Map<String, Object>> body) {
        long startNanos = System.nanoTime();
        boolean failed = false;
        try (LogContext ctx = LogContext.forToolCall(LogContext.generateCorrelationId(), tool, action)) {
            log.info("tool.dispatch tool={} action={}", tool, action);
            try {
                return body.get();
            } catch (RuntimeException e) {
                failed = true;
                Throwable cause = Futures.unwrap(e);
                log.warn("tool.failed tool={} action={} error={}", tool, action, cause.toString());
                return errorResult(describe(operation, cause));
            } finally {
                Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                metricsService.recordToolCall(tool, failed, duration);
                log.debug("tool.completed tool={} action={} error={} durationMs={}",
                        tool, action, failed, duration.toMillis());
            }
        }
    }

    public static Map<String, Object> errorResult(String message) {
        return Map.of("isError", true, "message", message);
    }

    static String describe(String operation, Throwable error) {
        if (error instanceof ToolValidationException) {
            return error.getMessage();
        }
        String hint = hintFor(error);
        if (hint != null) {
            return "Failed to " + operation + ": " + hint;
        }
        String message = error.getMessage() != null ? error.getMessage() : "System error occurred";
        return "Failed to " + operation + ": " + message;
    }

    private static String hintFor(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof AutomationException automation) {
                String hint = automationHint(automation.getApp(),
                        automation.getMessage() + " " + (automation.getStderr() != null ? automation.getStderr() : ""));
                if (hint != null) {
                    return hint;
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        if (error instanceof ContactSearchException search && search.isTimeout()) {
            return timeoutHint(CONTACTS_APP);
        }
        if (error instanceof IdentitySourceException source && source.isTimeout()) {
            return timeoutHint(CONTACTS_APP);
        }
        return null;
    }

    static String automationHint(String app, String text) {
        String name = app != null ? app : "The app";
        if (IdentitySourceException.looksLikeTimeout(text)) {
            return timeoutHint(name);
        }
        if (LOST_CONNECTION.matcher(text).find()) {
            return "Lost connection to " + name + ". The app may have been quit or restarted; try again.";
        }
        if (NOT_RUNNING.matcher(text).find()) {
            return name + " does not appear to be running. Open " + name + " and try again.";
        }
        return null;
    }

    private static String timeoutHint(String app) {
        return app + " did not respond in time. The app may be busy or unresponsive; try again or restart " + app + ".";
    }
}
