package com.contact.resolution.mcp.request;

import com.contact.resolution.mcp.ToolInputs;

import java.util.Map;

/**
 * Arguments of the {@code messages} read action.
 *
 * @param searchMessages search message text instead of chat names
 * @param contact        a person's name; restricts messages to that person's handles
 */
public record ReadMessagesRequest(
        String chatId,
        String search,
        boolean searchMessages,
        String contact,
        boolean enrichContacts,
        int limit,
        int offset
) {
    public static ReadMessagesRequest from(Map<String, Object> params) {
        return new ReadMessagesRequest(
                ToolInputs.optionalText(params, "chatId", ToolInputs.MAX_ID_LENGTH, "Chat id"),
                ToolInputs.optionalText(params, "search", ToolInputs.MAX_SEARCH_LENGTH, "Search term"),
                ToolInputs.optionalBoolean(params, "searchMessages", false),
                ToolInputs.optionalText(params, "contact", ToolInputs.MAX_TITLE_LENGTH, "Contact name"),
                ToolInputs.optionalBoolean(params, "enrichContacts", true),
                ToolInputs.limit(ToolInputs.optionalInt(params, "limit")),
                ToolInputs.offset(ToolInputs.optionalInt(params, "offset"))
        );
    }

    public boolean hasContactFilter() {
        return contact != null && !contact.isBlank();
    }
}
