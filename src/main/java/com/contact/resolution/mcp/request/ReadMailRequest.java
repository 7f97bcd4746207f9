package com.contact.resolution.mcp.request;

import com.contact.resolution.mcp.ToolInputs;

import java.util.Map;

/**
 * Arguments of the {@code mail} read action. {@code contact} is a person's
 * name; when set, only mail sent from one of that person's addresses is returned.
 */
public record ReadMailRequest(
        String id,
        String search,
        String mailbox,
        String account,
        String contact,
        boolean enrichContacts,
        int limit,
        int offset
) {
    public static ReadMailRequest from(Map<String, Object> params) {
        return new ReadMailRequest(
                ToolInputs.optionalText(params, "id", ToolInputs.MAX_ID_LENGTH, "Message id"),
                ToolInputs.optionalText(params, "search", ToolInputs.MAX_SEARCH_LENGTH, "Search term"),
                ToolInputs.optionalText(params, "mailbox", ToolInputs.MAX_NAME_LENGTH, "Mailbox"),
                ToolInputs.optionalText(params, "account", ToolInputs.MAX_NAME_LENGTH, "Account"),
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
