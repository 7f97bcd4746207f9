package com.contact.resolution.mcp;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactHandles;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.mcp.request.ContactsRequest;
import com.contact.resolution.pim.ContactWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code contacts} tool: find a person's handles by name, look up who a
 * handle belongs to, and create, update or delete contacts. Every successful
 * mutation drops the contact index so the next lookup sees the change.
 */
public final class ContactTools {
    private static final Logger log = LoggerFactory.getLogger(ContactTools.class);

    static final String TOOL_NAME = "contacts";

    private final ContactResolver resolver;
    private final ContactWriter writer;
    private final ToolExecution execution;

    /**
     * @param writer may be {@code null}, in which case mutations report an error
     */
    public ContactTools(ContactResolver resolver, ContactWriter writer, ToolExecution execution) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.writer = writer;
        this.execution = Objects.requireNonNull(execution, "execution is required");
    }

    public McpToolDefinition definition() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "action", Map.of("type", "string",
                                "enum", List.of("search", "resolve", "create", "update", "delete")),
                        "search", Map.of("type", "string", "description", "Name to search for (search)"),
                        "handle", Map.of("type", "string", "description", "Phone number or email (resolve)"),
                        "id", Map.of("type", "string", "description", "Contact id (update, delete)"),
                        "firstName", Map.of("type", "string"),
                        "lastName", Map.of("type", "string"),
                        "organization", Map.of("type", "string"),
                        "jobTitle", Map.of("type", "string"),
                        "email", Map.of("type", "string"),
                        "phone", Map.of("type", "string")
                ),
                "required", List.of("action")
        );
        return new McpToolDefinition(
                TOOL_NAME,
                "Search contacts by name, find who a phone number or email belongs to, "
                        + "or create, update and delete contacts.",
                schema,
                this::handle
        );
    }

    private Map<String, Object> handle(Map<String, Object> params) {
        Object action = params.get("action");
        String actionName = action instanceof String text ? text : "unknown";
        return execution.run(TOOL_NAME, actionName, actionName + " contact", () -> dispatch(params));
    }

    private Map<String, Object> dispatch(Map<String, Object> params) {
        ContactsRequest request = ContactsRequest.from(params);
        return switch (request.action()) {
            case SEARCH -> search(request.search());
            case RESOLVE -> resolve(request.handle());
            case CREATE -> {
                Contact created = Futures.join(requireWriter().createContact(request.draft()));
                resolver.invalidateCache();
                log.info("contact.created id={}", created.id());
                yield Map.of("success", true, "id", created.id(),
                        "message", "Successfully created contact \"" + created.fullName() + "\".");
            }
            case UPDATE -> {
                Contact updated = Futures.join(requireWriter().updateContact(request.id(), request.draft()));
                resolver.invalidateCache();
                log.info("contact.updated id={}", updated.id());
                yield Map.of("success", true, "id", updated.id(),
                        "message", "Successfully updated contact \"" + updated.fullName() + "\".");
            }
            case DELETE -> {
                Futures.join(requireWriter().deleteContact(request.id()));
                resolver.invalidateCache();
                log.info("contact.deleted id={}", request.id());
                yield Map.of("success", true, "id", request.id(),
                        "message", "Successfully deleted contact with ID: \"" + request.id() + "\".");
            }
        };
    }

    private Map<String, Object> search(String name) {
        Optional<ContactHandles> handles = Futures.join(resolver.resolveNameToHandles(name));
        if (handles.isEmpty()) {
            return Map.of("found", false, "message", "No contact with a phone number or email matches '" + name + "'.");
        }
        return Map.of(
                "found", true,
                "phones", handles.get().phones(),
                "emails", handles.get().emails());
    }

    private Map<String, Object> resolve(String handle) {
        Optional<ContactSummary> contact = Futures.join(resolver.resolveHandle(handle));
        if (contact.isEmpty()) {
            return Map.of("found", false, "message", "No contact found for " + handle + ".");
        }
        ContactSummary summary = contact.get();
        return Map.of(
                "found", true,
                "contact", ResultMaps.of(
                        "id", summary.id(),
                        "name", summary.displayName(),
                        "firstName", summary.firstName(),
                        "lastName", summary.lastName()));
    }

    private ContactWriter requireWriter() {
        if (writer == null) {
            throw new IllegalStateException("contact editing is not available");
        }
        return writer;
    }
}
