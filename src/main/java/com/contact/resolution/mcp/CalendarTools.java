package com.contact.resolution.mcp;

import com.contact.resolution.core.Futures;
import com.contact.resolution.core.model.ContactSummary;
import com.contact.resolution.enrichment.ContactEnricher;
import com.contact.resolution.enrichment.DisplayNames;
import com.contact.resolution.mcp.request.ReadCalendarEventsRequest;
import com.contact.resolution.pim.CalendarEvent;
import com.contact.resolution.pim.CalendarEventReader;
import com.contact.resolution.pim.EventQuery;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code calendar_events} tool: reads events and replaces attendee
 * addresses with contact names where they resolve.
 */
public final class CalendarTools {

    static final String TOOL_NAME = "calendar_events";
    static final int MAX_ENRICHED_HANDLES = 20;
    static final Duration ENRICHMENT_TIMEOUT = Duration.ofSeconds(5);
    static final String ENRICHMENT_LABEL = "calendar_enrichment";

    private final CalendarEventReader reader;
    private final ContactEnricher enricher;
    private final ToolExecution execution;

    public CalendarTools(CalendarEventReader reader, ContactEnricher enricher, ToolExecution execution) {
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.enricher = Objects.requireNonNull(enricher, "enricher is required");
        this.execution = Objects.requireNonNull(execution, "execution is required");
    }

    public McpToolDefinition definition() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "id", Map.of("type", "string", "description", "Event id; returns that single event"),
                        "startDate", Map.of("type", "string", "description", "Range start, YYYY-MM-DD"),
                        "endDate", Map.of("type", "string", "description", "Range end, YYYY-MM-DD"),
                        "filterCalendar", Map.of("type", "string", "description", "Only events from this calendar"),
                        "search", Map.of("type", "string", "description", "Text to match in title, notes or location"),
                        "enrichContacts", Map.of("type", "boolean", "default", true,
                                "description", "Replace attendee addresses with contact names")
                )
        );
        return new McpToolDefinition(
                TOOL_NAME,
                "Read calendar events by id or by date range, calendar and search text. "
                        + "Attendees are shown by contact name when known.",
                schema,
                params -> execution.run(TOOL_NAME, "read", "read calendar events", () -> read(params))
        );
    }

    private Map<String, Object> read(Map<String, Object> params) {
        ReadCalendarEventsRequest request = ReadCalendarEventsRequest.from(params);

        if (request.id() != null) {
            Optional<CalendarEvent> event = Futures.join(reader.findEventById(request.id()));
            if (event.isEmpty()) {
                return Map.of("found", false, "message", "Calendar event not found: " + request.id());
            }
            Map<String, ContactSummary> names = request.enrichContacts()
                    ? resolveAttendees(List.of(event.get())) : Map.of();
            return Map.of("found", true, "event", toMap(event.get(), names));
        }

        List<CalendarEvent> events = Futures.join(reader.findEvents(new EventQuery(
                request.startDate(), request.endDate(), request.calendar(), request.search())));
        Map<String, ContactSummary> names = request.enrichContacts() ? resolveAttendees(events) : Map.of();
        List<Map<String, Object>> rows = events.stream()
                .map(e -> toMap(e, names))
                .toList();
        return ResultMaps.of(
                "count", rows.size(),
                "events", rows,
                "message", rows.isEmpty() ? "No calendar events found." : null);
    }

    private Map<String, ContactSummary> resolveAttendees(List<CalendarEvent> events) {
        Set<String> attendees = new LinkedHashSet<>();
        events.forEach(e -> attendees.addAll(e.attendees()));
        return enricher.resolveNamesNow(attendees, MAX_ENRICHED_HANDLES, ENRICHMENT_TIMEOUT, ENRICHMENT_LABEL);
    }

    private static Map<String, Object> toMap(CalendarEvent event, Map<String, ContactSummary> names) {
        List<String> attendees = event.attendees().stream()
                .map(a -> DisplayNames.fromLookup(names, null, a))
                .toList();
        return ResultMaps.of(
                "id", event.id(),
                "title", event.title(),
                "calendar", event.calendar(),
                "startDate", event.startDate(),
                "endDate", event.endDate(),
                "allDay", event.allDay() ? Boolean.TRUE : null,
                "location", event.location(),
                "notes", event.notes(),
                "url", event.url(),
                "attendees", attendees.isEmpty() ? null : attendees);
    }
}
