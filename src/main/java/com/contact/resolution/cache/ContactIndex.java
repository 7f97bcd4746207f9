package com.contact.resolution.cache;

import com.contact.resolution.core.model.BuildOutcome;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.core.model.HandleKind;
import com.contact.resolution.rules.HandleNormalizer;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the address book keyed by normalized handle.
 *
 * <p>Phones are indexed under their digits in the exact map and under their
 * last ten digits in a separate suffix map, so numbers match with or without a
 * country code. Emails are indexed lowercase. In each map the first contact to
 * claim a key keeps it; later contacts with the same key are dropped. A suffix
 * key never shadows another contact's exact number.</p>
 */
public final class ContactIndex {

    private final Map<String, ContactSummary> entries;
    private final Map<String, ContactSummary> suffixes;
    private final Instant builtAt;
    private final BuildOutcome outcome;

    private ContactIndex(Map<String, ContactSummary> entries, Map<String, ContactSummary> suffixes,
                         Instant builtAt, BuildOutcome outcome) {
        this.entries = entries;
        this.suffixes = suffixes;
        this.builtAt = builtAt;
        this.outcome = outcome;
    }

    public static ContactIndex of(Collection<Contact> contacts, Instant builtAt) {
        Objects.requireNonNull(contacts, "contacts is required");
        Map<String, ContactSummary> entries = new HashMap<>();
        Map<String, ContactSummary> suffixes = new HashMap<>();
        for (Contact contact : contacts) {
            ContactSummary summary = ContactSummary.of(contact);
            for (String phone : contact.phones()) {
                String normalized = HandleNormalizer.normalizePhone(phone);
                if (normalized.isEmpty()) {
                    continue;
                }
                entries.putIfAbsent(normalized, summary);
                suffixes.putIfAbsent(HandleNormalizer.phoneSuffix(normalized), summary);
            }
            for (String email : contact.emails()) {
                String normalized = HandleNormalizer.normalizeEmail(email);
                if (!normalized.isEmpty()) {
                    entries.putIfAbsent(normalized, summary);
                }
            }
        }
        return new ContactIndex(Map.copyOf(entries), Map.copyOf(suffixes), builtAt, BuildOutcome.LOADED);
    }

    /**
     * An index with no entries, recording why the build produced nothing.
     */
    public static ContactIndex empty(BuildOutcome outcome, Instant builtAt) {
        return new ContactIndex(Map.of(), Map.of(), builtAt, outcome);
    }

    /**
     * Looks up a raw handle: exact normalized key first, then for phones the
     * suffix map under the last ten digits. Handles that classify as {@link HandleKind#UNKNOWN}
     * never match.
     */
    public Optional<ContactSummary> lookup(String rawHandle) {
        HandleKind kind = HandleNormalizer.classify(rawHandle);
        if (kind == HandleKind.UNKNOWN) {
            return Optional.empty();
        }
        String normalized = HandleNormalizer.normalize(rawHandle);
        ContactSummary exact = entries.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (kind == HandleKind.PHONE) {
            return Optional.ofNullable(suffixes.get(HandleNormalizer.phoneSuffix(normalized)));
        }
        return Optional.empty();
    }

    /**
     * Number of exact normalized keys; suffix keys are not counted.
     */
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public BuildOutcome getOutcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "ContactIndex{size=" + entries.size() + ", outcome=" + outcome + ", builtAt=" + builtAt + '}';
    }
}
