package com.contact.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A contact as returned by the identity source, with every phone number and
 * email address in the raw form the source stores them.
 *
 * @param id        source-assigned contact identifier
 * @param fullName  display name as composed by the source (may be empty)
 * @param firstName given name, or {@code null}
 * @param lastName  family name, or {@code null}
 * @param phones    raw phone numbers
 * @param emails    raw email addresses
 */
public record Contact(
        String id,
        String fullName,
        String firstName,
        String lastName,
        List<String> phones,
        List<String> emails
) {
    public Contact {
        Objects.requireNonNull(id, "id is required");
        fullName = fullName != null ? fullName : "";
        phones = phones != null ? List.copyOf(phones) : List.of();
        emails = emails != null ? List.copyOf(emails) : List.of();
    }

    public boolean hasHandles() {
        return !phones.isEmpty() || !emails.isEmpty();
    }
}
