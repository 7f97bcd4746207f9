package com.contact.resolution.pim;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the mail store.
 */
public interface MailReader {

    CompletableFuture<Optional<MailMessage>> findMessageById(String id);

    CompletableFuture<List<MailMessage>> findMessages(MailQuery query);
}
