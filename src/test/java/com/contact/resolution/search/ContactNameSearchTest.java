package com.contact.resolution.search;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.metrics.MicrometerMetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.source.IdentitySourceException;
import com.contact.resolution.source.ScriptedIdentitySource;
import com.contact.resolution.source.TestContacts;
import com.contact.resolution.tracing.NoOpTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContactNameSearch Tests")
class ContactNameSearchTest {

    private static final Contact JOHN_WORK = new Contact("c-10", "John Doe", "John", "Doe",
            List.of("+1 (555) 123-4567", "555.999.0000"), List.of("JOHN@work.example.com"));

    private static final Contact JOHN_HOME = new Contact("c-11", "Johnny Appleseed", "Johnny", "Appleseed",
            List.of("15551234567"), List.of("john@work.example.com", "johnny@home.example.com"));

    private ContactNameSearch search(ScriptedIdentitySource source) {
        return new ContactNameSearch(source, new NoOpMetricsService(), new NoOpTracingService());
    }

    @Nested
    @DisplayName("Matches")
    class MatchTests {

        @Test
        @DisplayName("Handles across matches are normalized and deduplicated in order")
        void mergesAndDedupes() {
            ScriptedIdentitySource source = new ScriptedIdentitySource(List.of())
                    .searchReturns(List.of(JOHN_WORK, JOHN_HOME));

            ContactHandles handles = search(source).resolveNameToHandles("John").join().orElseThrow();

            assertEquals(List.of("15551234567", "5559990000"), handles.phones());
            assertEquals(List.of("john@work.example.com", "johnny@home.example.com"), handles.emails());
            assertEquals(1, source.searchCalls());
        }

        @Test
        @DisplayName("Each call queries the source and never builds the bulk index")
        void neverCached() {
            ScriptedIdentitySource source = new ScriptedIdentitySource(TestContacts.all())
                    .searchReturns(List.of(TestContacts.JANE));
            ContactNameSearch nameSearch = search(source);

            nameSearch.resolveNameToHandles("Jane").join();
            nameSearch.resolveNameToHandles("Jane").join();

            assertEquals(2, source.searchCalls());
            assertEquals(0, source.fetchCalls());
        }

        @Test
        @DisplayName("No match resolves to empty")
        void noMatch() {
            ScriptedIdentitySource source = new ScriptedIdentitySource(List.of());

            assertEquals(Optional.empty(), search(source).resolveNameToHandles("Nobody").join());
        }

        @Test
        @DisplayName("Matches without any handle resolve to empty")
        void matchWithoutHandles() {
            Contact bare = new Contact("c-12", "Bare Person", null, null, List.of(" "), List.of());
            ScriptedIdentitySource source = new ScriptedIdentitySource(List.of()).searchReturns(List.of(bare));

            assertEquals(Optional.empty(), search(source).resolveNameToHandles("Bare").join());
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("Blank names resolve to empty without a source call")
        void blankName(String name) {
            ScriptedIdentitySource source = new ScriptedIdentitySource(TestContacts.all());

            assertEquals(Optional.empty(), search(source).resolveNameToHandles(name).join());
            assertEquals(0, source.searchCalls());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Permission denied resolves to empty")
        void permissionDenied() {
            ScriptedIdentitySource source = ScriptedIdentitySource.failing(
                    IdentitySourceException.permissionDenied("Not authorized to access Contacts"));

            assertEquals(Optional.empty(), search(source).resolveNameToHandles("John").join());
        }

        @Test
        @DisplayName("Timeouts fail with a timeout-flagged search error")
        void timeout() {
            ScriptedIdentitySource source = ScriptedIdentitySource.failing(
                    new IdentitySourceException("Contacts search timed out after 15000ms", false));

            CompletionException error = assertThrows(CompletionException.class,
                    () -> search(source).resolveNameToHandles("John").join());

            ContactSearchException searchError = assertInstanceOf(ContactSearchException.class, error.getCause());
            assertTrue(searchError.isTimeout());
            assertInstanceOf(IdentitySourceException.class, searchError.getCause());
        }

        @Test
        @DisplayName("Timeout wording is recognised on foreign exceptions too")
        void foreignTimeout() {
            ScriptedIdentitySource source = ScriptedIdentitySource.failing(
                    new IllegalStateException("Request Timed Out"));

            CompletionException error = assertThrows(CompletionException.class,
                    () -> search(source).resolveNameToHandles("John").join());

            assertTrue(assertInstanceOf(ContactSearchException.class, error.getCause()).isTimeout());
        }

        @Test
        @DisplayName("Other failures fail without the timeout flag")
        void otherFailure() {
            ScriptedIdentitySource source = ScriptedIdentitySource.failing(
                    new IdentitySourceException("Contacts got an error: application isn't running", false));

            CompletionException error = assertThrows(CompletionException.class,
                    () -> search(source).resolveNameToHandles("John").join());

            ContactSearchException searchError = assertInstanceOf(ContactSearchException.class, error.getCause());
            assertFalse(searchError.isTimeout());
            assertTrue(searchError.getMessage().contains("isn't running"));
        }
    }

    @Test
    @DisplayName("Should count searches by outcome")
    void recordsOutcomes() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScriptedIdentitySource source = new ScriptedIdentitySource(List.of())
                .searchReturns(List.of(TestContacts.JOHN));
        ContactNameSearch nameSearch = new ContactNameSearch(source,
                new MicrometerMetricsService(registry), new NoOpTracingService());

        nameSearch.resolveNameToHandles("John").join();
        source.searchReturns(List.of());
        nameSearch.resolveNameToHandles("Nobody").join();

        assertEquals(1.0, registry.find("contact.search").tag("outcome", "found").counter().count());
        assertEquals(1.0, registry.find("contact.search").tag("outcome", "empty").counter().count());
    }
}
