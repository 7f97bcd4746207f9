package com.contact.resolution.source;

import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.Contact;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link IdentitySource} backed by the Contacts app through the OS automation layer.
 *
 * <p>Expected result shape for both operations:</p>
 * <pre>{@code
 * [
 *   {
 *     "id": "ABC:ABPerson",
 *     "fullName": "John Doe",
 *     "firstName": "John",
 *     "lastName": "Doe",
 *     "phones": ["+1 (555) 123-4567"],
 *     "emails": ["john.doe@example.com"]
 *   }
 * ]
 * }</pre>
 */
public class AutomationIdentitySource implements IdentitySource {
    private static final Logger log = LoggerFactory.getLogger(AutomationIdentitySource.class);

    static final String APP = "Contacts";
    static final String FETCH_ALL_OPERATION = "contacts.fetchAll";
    static final String SEARCH_BY_NAME_OPERATION = "contacts.searchByName";

    private static final int MAX_CONTACTS = 10_000;
    private static final Duration FETCH_ALL_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(15);

    private final AutomationExecutor executor;
    private final ObjectMapper objectMapper;

    public AutomationIdentitySource(AutomationExecutor executor) {
        this(executor, new ObjectMapper());
    }

    public AutomationIdentitySource(AutomationExecutor executor, ObjectMapper objectMapper) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public CompletableFuture<List<Contact>> fetchAllContacts() {
        AutomationRequest request = new AutomationRequest(APP, FETCH_ALL_OPERATION,
                Map.of("limit", String.valueOf(MAX_CONTACTS)), FETCH_ALL_TIMEOUT);
        return run(request, true);
    }

    @Override
    public CompletableFuture<List<Contact>> searchContactsByName(String query) {
        AutomationRequest request = new AutomationRequest(APP, SEARCH_BY_NAME_OPERATION,
                Map.of("query", query), SEARCH_TIMEOUT);
        return run(request, false);
    }

    @Override
    public String getName() {
        return "automation:" + APP;
    }

    private CompletableFuture<List<Contact>> run(AutomationRequest request, boolean skipWithoutHandles) {
        return Futures.call(() -> executor.execute(request))
                .handle((json, error) -> {
                    if (error != null) {
                        throw translate(request, Futures.unwrap(error));
                    }
                    return toContacts(json, skipWithoutHandles);
                });
    }

    private IdentitySourceException translate(AutomationRequest request, Throwable cause) {
        if (cause instanceof IdentitySourceException alreadyTranslated) {
            return alreadyTranslated;
        }
        boolean permission = cause instanceof AutomationException automation && automation.isPermissionError();
        log.debug("automation.failed operation={} permission={} message={}",
                request.operation(), permission, cause.getMessage());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new IdentitySourceException(message, permission, cause);
    }

    List<Contact> toContacts(JsonNode json, boolean skipWithoutHandles) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return List.of();
        }
        if (!json.isArray()) {
            throw new IdentitySourceException("Unexpected contact payload: expected an array but got "
                    + json.getNodeType(), false);
        }

        List<Contact> contacts = new ArrayList<>(json.size());
        for (JsonNode node : json) {
            ContactPayload payload;
            try {
                payload = objectMapper.treeToValue(node, ContactPayload.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable contact entry: {}", e.getOriginalMessage());
                continue;
            }
            if (payload == null || payload.id() == null || payload.id().isBlank()) {
                continue;
            }
            Contact contact = new Contact(payload.id(), payload.fullName(), payload.firstName(),
                    payload.lastName(), dropBlank(payload.phones()), dropBlank(payload.emails()));
            if (skipWithoutHandles && !contact.hasHandles()) {
                continue;
            }
            contacts.add(contact);
        }
        return contacts;
    }

    private static List<String> dropBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContactPayload(
            String id,
            String fullName,
            String firstName,
            String lastName,
            List<String> phones,
            List<String> emails
    ) {
    }
}
