package com.contact.resolution.pim;

import java.util.Set;

/**
 * Filters for {@link MessageReader}. {@code senderHandles}, when non-empty,
 * restricts results to messages whose sender normalizes to one of the handles.
 */
public record MessageQuery(String chatId, String search, Set<String> senderHandles, int limit, int offset) {

    public MessageQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        senderHandles = senderHandles != null ? Set.copyOf(senderHandles) : Set.of();
    }
}
