package com.contact.resolution.pim;

import java.util.List;
import java.util.Objects;

/**
 * A mail message. {@code sender} is the header value as the mail app reports
 * it, either a bare address or {@code "Name <address>"}. {@code content} is
 * only present when the message was read by id.
 */
public record MailMessage(
        String id,
        String subject,
        String sender,
        String dateReceived,
        boolean read,
        String mailbox,
        String account,
        String preview,
        String content,
        List<String> toRecipients,
        List<String> ccRecipients
) {
    public MailMessage {
        Objects.requireNonNull(id, "id is required");
        toRecipients = toRecipients != null ? List.copyOf(toRecipients) : List.of();
        ccRecipients = ccRecipients != null ? List.copyOf(ccRecipients) : List.of();
    }
}
