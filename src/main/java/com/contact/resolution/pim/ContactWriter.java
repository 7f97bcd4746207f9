package com.contact.resolution.pim;

import com.contact.resolution.core.model.Contact;

import java.util.concurrent.CompletableFuture;

/**
 * Write access to the address book.
 */
public interface ContactWriter {

    CompletableFuture<Contact> createContact(ContactDraft draft);

    CompletableFuture<Contact> updateContact(String id, ContactDraft draft);

    CompletableFuture<Void> deleteContact(String id);
}
