package com.contact.resolution.pim;

/**
 * Filters for {@link MailReader#findMessages}. A null mailbox means the inbox.
 */
public record MailQuery(String mailbox, String account, String search, int limit, int offset) {

    public MailQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }
}
