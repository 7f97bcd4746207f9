package com.contact.resolution.enrichment;

import com.contact.resolution.core.model.ContactSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DisplayNames Tests")
class DisplayNamesTest {

    private static final String HANDLE = "+15551234567";

    @Test
    @DisplayName("Resolved name wins over everything")
    void resolvedFirst() {
        assertEquals("John Doe", DisplayNames.render("John Doe", "Someone Display", HANDLE));
    }

    @Test
    @DisplayName("Existing display name is kept when nothing resolved")
    void existingSecond() {
        assertEquals("Someone Display", DisplayNames.render(null, "Someone Display", HANDLE));
        assertEquals("Someone Display", DisplayNames.fromLookup(Map.of(), "Someone Display", HANDLE));
    }

    @Test
    @DisplayName("Raw handle is the last resort")
    void rawLast() {
        assertEquals(HANDLE, DisplayNames.render(null, null, HANDLE));
        assertEquals(HANDLE, DisplayNames.render("  ", "", HANDLE));
    }

    @Test
    @DisplayName("Lookup renders the resolved contact's name")
    void fromLookup() {
        Map<String, ContactSummary> resolved = Map.of(HANDLE, new ContactSummary("c-1", "John Doe", "John", "Doe"));

        assertEquals("John Doe", DisplayNames.fromLookup(resolved, "Someone Display", HANDLE));
        assertEquals("other@example.com", DisplayNames.fromLookup(resolved, null, "other@example.com"));
        assertNull(DisplayNames.fromLookup(resolved, null, null));
    }

    @Test
    @DisplayName("Contact without a full name falls back to first and last name")
    void nameFromParts() {
        ContactSummary partial = new ContactSummary("c-5", "", "Ada", "Lovelace");
        ContactSummary nameless = new ContactSummary("c-6", "", null, null);

        assertEquals("Ada Lovelace", DisplayNames.forContact(partial, "ignored", HANDLE));
        assertEquals("Someone Display", DisplayNames.forContact(nameless, "Someone Display", HANDLE));
    }
}
