package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * Lightweight, immutable view of a contact handed out by the resolution cache.
 * Callers must not rely on instance identity across cache rebuilds.
 *
 * @param id        contact identifier
 * @param fullName  full display name
 * @param firstName given name, or {@code null}
 * @param lastName  family name, or {@code null}
 */
public record ContactSummary(String id, String fullName, String firstName, String lastName) {

    public ContactSummary {
        Objects.requireNonNull(id, "id is required");
        fullName = fullName != null ? fullName : "";
        firstName = blankToNull(firstName);
        lastName = blankToNull(lastName);
    }

    public static ContactSummary of(Contact contact) {
        return new ContactSummary(contact.id(), contact.fullName(), contact.firstName(), contact.lastName());
    }

    /**
     * Returns the best human-readable name: the full name, else first and last
     * name joined, else {@code null} when the contact carries no name at all.
     */
    public String displayName() {
        if (!fullName.isBlank()) {
            return fullName;
        }
        String joined = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        return joined.isEmpty() ? null : joined;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
