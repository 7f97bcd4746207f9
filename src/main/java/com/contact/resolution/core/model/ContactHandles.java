package com.contact.resolution.core.model;

import java.util.List;

/**
 * Normalized phone numbers and email addresses belonging to the contacts that
 * matched a name query.
 */
public record ContactHandles(List<String> phones, List<String> emails) {

    public ContactHandles {
        phones = phones != null ? List.copyOf(phones) : List.of();
        emails = emails != null ? List.copyOf(emails) : List.of();
    }

    public boolean isEmpty() {
        return phones.isEmpty() && emails.isEmpty();
    }

    public int size() {
        return phones.size() + emails.size();
    }
}
