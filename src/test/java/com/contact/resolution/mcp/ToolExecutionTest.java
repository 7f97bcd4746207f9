package com.contact.resolution.mcp;

import com.contact.resolution.metrics.MicrometerMetricsService;
import com.contact.resolution.search.ContactSearchException;
import com.contact.resolution.source.AutomationException;
import com.contact.resolution.source.IdentitySourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ToolExecution Tests")
class ToolExecutionTest {

    private SimpleMeterRegistry registry;
    private ToolExecution execution;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        execution = new ToolExecution(new MicrometerMetricsService(registry));
    }

    private Map<String, Object> failWith(RuntimeException error) {
        return execution.run("mail", "read", "read mail", () -> {
            throw error;
        });
    }

    @Test
    @DisplayName("Successful body result is returned as is")
    void success() {
        Map<String, Object> result = execution.run("mail", "read", "read mail", () -> Map.of("count", 0));

        assertEquals(Map.of("count", 0), result);
        assertEquals(1, registry.find("contact.tool.duration")
                .tag("tool", "mail").tag("error", "false").timer().count());
    }

    @Test
    @DisplayName("Validation errors keep their own message")
    void validationMessageVerbatim() {
        Map<String, Object> result = failWith(new ToolValidationException("Search term is required"));

        assertEquals(true, result.get("isError"));
        assertEquals("Search term is required", result.get("message"));
        assertEquals(1, registry.find("contact.tool.duration")
                .tag("tool", "mail").tag("error", "true").timer().count());
    }

    @Test
    @DisplayName("Other errors are prefixed with the operation")
    void genericFailure() {
        Map<String, Object> result = failWith(new IllegalStateException("disk full"));

        assertEquals("Failed to read mail: disk full", result.get("message"));
    }

    @Test
    @DisplayName("Completion wrappers are stripped before describing")
    void unwrapsCompletion() {
        Map<String, Object> result = failWith(new CompletionException(new IllegalStateException("inner")));

        assertEquals("Failed to read mail: inner", result.get("message"));
    }

    @Nested
    @DisplayName("Hints")
    class HintTests {

        @Test
        void automationTimeout() {
            Map<String, Object> result = failWith(new AutomationException("Script timed out", "Mail", false));

            assertEquals("Failed to read mail: Mail did not respond in time. The app may be busy or unresponsive; "
                    + "try again or restart Mail.", result.get("message"));
        }

        @Test
        void lostConnection() {
            Map<String, Object> result = failWith(new AutomationException("execution error",
                    "Messages", false, "Connection is invalid. (-609)"));

            assertEquals("Failed to read mail: Lost connection to Messages. The app may have been quit or restarted; "
                    + "try again.", result.get("message"));
        }

        @Test
        void notRunning() {
            Map<String, Object> result = failWith(new AutomationException("Calendar got an error: Application isn't running",
                    "Calendar", false));

            assertEquals("Failed to read mail: Calendar does not appear to be running. Open Calendar and try again.",
                    result.get("message"));
        }

        @Test
        void contactSearchTimeout() {
            Map<String, Object> result = failWith(new ContactSearchException("search failed", true,
                    new IdentitySourceException("gave up", false)));

            assertEquals("Failed to read mail: Contacts did not respond in time. The app may be busy or unresponsive; "
                    + "try again or restart Contacts.", result.get("message"));
        }

        @Test
        void contactSearchOtherFailure() {
            Map<String, Object> result = failWith(new ContactSearchException("Contact search for 'x' failed: boom",
                    false, new IdentitySourceException("boom", false)));

            assertEquals("Failed to read mail: Contact search for 'x' failed: boom", result.get("message"));
        }
    }

    @Test
    @DisplayName("Missing error message falls back to a generic one")
    void missingMessage() {
        Map<String, Object> result = failWith(new IllegalStateException());

        assertEquals("Failed to read mail: System error occurred", result.get("message"));
    }
}
