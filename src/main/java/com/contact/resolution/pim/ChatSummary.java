package com.contact.resolution.pim;

import java.util.List;
import java.util.Objects;

/**
 * A chat thread. Participants are raw phone or email handles.
 */
public record ChatSummary(String id, String name, List<String> participants, String lastMessage, String lastDate) {

    public ChatSummary {
        Objects.requireNonNull(id, "id is required");
        participants = participants != null ? List.copyOf(participants) : List.of();
    }
}
