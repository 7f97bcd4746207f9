package com.contact.resolution.pim;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the calendar store.
 */
public interface CalendarEventReader {

    CompletableFuture<Optional<CalendarEvent>> findEventById(String id);

    CompletableFuture<List<CalendarEvent>> findEvents(EventQuery query);
}
