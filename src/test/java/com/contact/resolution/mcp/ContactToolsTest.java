package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.pim.ContactDraft;
import com.contact.resolution.pim.ContactWriter;
import com.contact.resolution.source.InMemoryIdentitySource;
import com.contact.resolution.source.TestContacts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ContactTools Tests")
class ContactToolsTest {

    @Mock
    private ContactWriter writer;

    private InMemoryIdentitySource source;
    private ContactResolver resolver;
    private ToolExecution execution;
    private McpToolDefinition tool;

    @BeforeEach
    void setUp() {
        source = new InMemoryIdentitySource(TestContacts.all());
        resolver = ContactResolver.builder().identitySource(source).build();
        execution = new ToolExecution(new NoOpMetricsService());
        tool = new ContactTools(resolver, writer, execution).definition();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        void searchReturnsHandles() {
            Map<String, Object> result = tool.call(Map.of("action", "search", "search", "Jane"));

            assertEquals(true, result.get("found"));
            assertEquals(List.of("442079460958"), result.get("phones"));
            assertEquals(List.of("jane.smith@example.com"), result.get("emails"));
        }

        @Test
        void searchWithoutMatch() {
            Map<String, Object> result = tool.call(Map.of("action", "search", "search", "Zed"));

            assertEquals(false, result.get("found"));
        }

        @Test
        @SuppressWarnings("unchecked")
        void resolveHandle() {
            Map<String, Object> result = tool.call(Map.of("action", "resolve", "handle", "(212) 555-1234"));

            assertEquals(true, result.get("found"));
            Map<String, Object> contact = (Map<String, Object>) result.get("contact");
            assertEquals("c-3", contact.get("id"));
            assertEquals("Bob Wilson", contact.get("name"));
        }

        @Test
        void resolveUnknownHandle() {
            Map<String, Object> result = tool.call(Map.of("action", "RESOLVE", "handle", "nobody@example.com"));

            assertEquals(Map.of("found", false, "message", "No contact found for nobody@example.com."), result);
        }
    }

    @Nested
    @DisplayName("Mutations")
    class MutationTests {

        @Test
        @DisplayName("Create drops the index so the new contact resolves")
        void createInvalidates() {
            resolver.resolveHandle("john.doe@example.com").join();
            assertEquals(5, resolver.getCacheSize());

            Contact created = new Contact("c-4", "Ada Lovelace", "Ada", "Lovelace",
                    List.of(), List.of("ada@example.com"));
            when(writer.createContact(any())).thenAnswer(inv -> {
                source.add(created);
                return CompletableFuture.completedFuture(created);
            });

            Map<String, Object> result = tool.call(Map.of("action", "create",
                    "firstName", "Ada", "lastName", "Lovelace", "email", "ada@example.com"));

            assertEquals(true, result.get("success"));
            assertEquals("Successfully created contact \"Ada Lovelace\".", result.get("message"));
            assertEquals(0, resolver.getCacheSize());
            assertEquals("c-4", resolver.resolveHandle("ada@example.com").join().orElseThrow().id());
            verify(writer).createContact(new ContactDraft("Ada", "Lovelace", null, null, "ada@example.com", null, null));
        }

        @Test
        void update() {
            Contact updated = new Contact("c-1", "Johnny Doe", "Johnny", "Doe", List.of(), List.of());
            when(writer.updateContact(eq("c-1"), any())).thenReturn(CompletableFuture.completedFuture(updated));

            Map<String, Object> result = tool.call(Map.of("action", "update", "id", "c-1", "firstName", "Johnny"));

            assertEquals("Successfully updated contact \"Johnny Doe\".", result.get("message"));
        }

        @Test
        void delete() {
            when(writer.deleteContact("c-2")).thenReturn(CompletableFuture.completedFuture(null));

            Map<String, Object> result = tool.call(Map.of("action", "delete", "id", "c-2"));

            assertEquals(Map.of("success", true, "id", "c-2",
                    "message", "Successfully deleted contact with ID: \"c-2\"."), result);
        }

        @Test
        void writerFailureKeepsIndex() {
            resolver.resolveHandle("john.doe@example.com").join();
            when(writer.deleteContact("c-2")).thenReturn(CompletableFuture.failedFuture(
                    new IllegalStateException("contact is read-only")));

            Map<String, Object> result = tool.call(Map.of("action", "delete", "id", "c-2"));

            assertEquals("Failed to delete contact: contact is read-only", result.get("message"));
            assertEquals(5, resolver.getCacheSize());
        }

        @Test
        void editingUnavailableWithoutWriter() {
            McpToolDefinition readOnly = new ContactTools(resolver, null, execution).definition();

            Map<String, Object> result = readOnly.call(Map.of("action", "delete", "id", "c-2"));

            assertEquals("Failed to delete contact: contact editing is not available", result.get("message"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        void createNeedsAName() {
            Map<String, Object> result = tool.call(Map.of("action", "create", "email", "a@example.com"));

            assertEquals("At least one of firstName, lastName, or organization is required", result.get("message"));
            verifyNoInteractions(writer);
        }

        @Test
        void unknownAction() {
            Map<String, Object> result = tool.call(Map.of("action", "merge"));

            assertEquals("Unknown contacts action: merge", result.get("message"));
        }

        @Test
        void missingAction() {
            Map<String, Object> result = tool.call(Map.of());

            assertEquals(true, result.get("isError"));
            assertEquals("action is required", result.get("message"));
        }
    }
}
