package com.contact.resolution.source;

import com.contact.resolution.core.model.Contact;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The system address book, seen as an expensive remote collaborator.
 *
 * <p>Both calls may take seconds to tens of seconds. Failures complete the
 * returned future exceptionally with an {@link IdentitySourceException} whose
 * {@link IdentitySourceException#isPermissionError()} flag separates "access
 * blocked" from every other failure.</p>
 */
public interface IdentitySource {

    /**
     * Fetches every contact that has at least one phone number or email address.
     */
    CompletableFuture<List<Contact>> fetchAllContacts();

    /**
     * Fetches the contacts whose name matches the query, filtered on the source side.
     */
    CompletableFuture<List<Contact>> searchContactsByName(String query);

    /**
     * Short name used in logs and health details.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
