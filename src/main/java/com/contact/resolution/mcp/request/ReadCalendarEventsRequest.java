package com.contact.resolution.mcp.request;

import com.contact.resolution.mcp.ToolInputs;
import com.contact.resolution.mcp.ToolValidationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Arguments of the {@code calendar_events} read action.
 * Dates must start with {@code YYYY-MM-DD}; time and zone suffixes are passed through.
 */
public record ReadCalendarEventsRequest(
        String id,
        String startDate,
        String endDate,
        String calendar,
        String search,
        boolean enrichContacts
) {
    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*$");

    public ReadCalendarEventsRequest {
        checkDate(startDate, "startDate");
        checkDate(endDate, "endDate");
    }

    public static ReadCalendarEventsRequest from(Map<String, Object> params) {
        return new ReadCalendarEventsRequest(
                ToolInputs.optionalText(params, "id", ToolInputs.MAX_ID_LENGTH, "Event id"),
                ToolInputs.optionalText(params, "startDate", ToolInputs.MAX_NAME_LENGTH, "Start date"),
                ToolInputs.optionalText(params, "endDate", ToolInputs.MAX_NAME_LENGTH, "End date"),
                ToolInputs.optionalText(params, "filterCalendar", ToolInputs.MAX_NAME_LENGTH, "Calendar"),
                ToolInputs.optionalText(params, "search", ToolInputs.MAX_SEARCH_LENGTH, "Search term"),
                ToolInputs.optionalBoolean(params, "enrichContacts", true)
        );
    }

    private static void checkDate(String value, String field) {
        if (value != null && !DATE.matcher(value).matches()) {
            throw new ToolValidationException(field + " must be a date in YYYY-MM-DD format");
        }
    }
}
