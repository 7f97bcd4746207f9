package com.contact.resolution.source;

import com.contact.resolution.core.model.Contact;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixture-backed {@link IdentitySource} for local development and tests.
 * Name search is a case-insensitive substring match on full, first and last name.
 */
public class InMemoryIdentitySource implements IdentitySource {

    private final List<Contact> contacts = new CopyOnWriteArrayList<>();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger searchCount = new AtomicInteger();

    public InMemoryIdentitySource() {
    }

    public InMemoryIdentitySource(List<Contact> contacts) {
        this.contacts.addAll(contacts);
    }

    public void add(Contact contact) {
        contacts.add(contact);
    }

    public boolean remove(String contactId) {
        return contacts.removeIf(c -> c.id().equals(contactId));
    }

    public void clear() {
        contacts.clear();
    }

    @Override
    public CompletableFuture<List<Contact>> fetchAllContacts() {
        fetchCount.incrementAndGet();
        return CompletableFuture.completedFuture(contacts.stream()
                .filter(Contact::hasHandles)
                .toList());
    }

    @Override
    public CompletableFuture<List<Contact>> searchContactsByName(String query) {
        searchCount.incrementAndGet();
        String term = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();
        return CompletableFuture.completedFuture(contacts.stream()
                .filter(c -> matches(c, term))
                .toList());
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    public int getFetchCount() {
        return fetchCount.get();
    }

    public int getSearchCount() {
        return searchCount.get();
    }

    private static boolean matches(Contact contact, String term) {
        if (term.isEmpty()) {
            return false;
        }
        return contains(contact.fullName(), term)
                || contains(contact.firstName(), term)
                || contains(contact.lastName(), term);
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }
}
