package com.contact.resolution.pim;

import java.util.List;
import java.util.Objects;

/**
 * A calendar event as returned by the calendar store. Attendees are raw
 * email addresses.
 */
public record CalendarEvent(
        String id,
        String title,
        String calendar,
        String startDate,
        String endDate,
        String location,
        String notes,
        String url,
        boolean allDay,
        List<String> attendees
) {
    public CalendarEvent {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
        attendees = attendees != null ? List.copyOf(attendees) : List.of();
    }
}
