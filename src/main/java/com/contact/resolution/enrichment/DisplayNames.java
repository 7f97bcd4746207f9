package com.contact.resolution.enrichment;

import com.contact.resolution.core.model.ContactSummary;

import java.util.Map;

/**
 * Picks the name shown next to a handle: the resolved contact name, else the
 * display name the row already carried, else the raw handle. Blank values
 * count as absent.
 */
public final class DisplayNames {

    private DisplayNames() {
        // Utility class
    }

    public static String render(String resolvedName, String existingDisplayName, String rawHandle) {
        if (hasText(resolvedName)) {
            return resolvedName;
        }
        if (hasText(existingDisplayName)) {
            return existingDisplayName;
        }
        return rawHandle;
    }

    public static String forContact(ContactSummary resolved, String existingDisplayName, String rawHandle) {
        return render(resolved != null ? resolved.displayName() : null, existingDisplayName, rawHandle);
    }

    /**
     * Looks {@code rawHandle} up in an enrichment result and renders it.
     */
    public static String fromLookup(Map<String, ContactSummary> resolved, String existingDisplayName, String rawHandle) {
        ContactSummary summary = rawHandle != null && resolved != null ? resolved.get(rawHandle) : null;
        return forContact(summary, existingDisplayName, rawHandle);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
