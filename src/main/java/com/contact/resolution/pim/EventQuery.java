package com.contact.resolution.pim;

/**
 * Filters for {@link CalendarEventReader#findEvents}. Every field is optional.
 */
public record EventQuery(String startDate, String endDate, String calendarName, String search) {
}
