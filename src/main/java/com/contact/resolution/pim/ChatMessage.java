package com.contact.resolution.pim;

import java.util.Objects;

/**
 * One message in a chat. {@code sender} is a raw handle, or a placeholder such
 * as {@code "me"} or {@code "unknown"} when the store has none.
 */
public record ChatMessage(String id, String chatId, String text, String sender, String date, boolean fromMe) {

    public ChatMessage {
        Objects.requireNonNull(id, "id is required");
        text = text != null ? text : "";
    }
}
