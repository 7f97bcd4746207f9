package com.contact.resolution.mcp.request;

import com.contact.resolution.mcp.ToolInputs;
import com.contact.resolution.mcp.ToolValidationException;
import com.contact.resolution.pim.ContactDraft;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Arguments of the {@code contacts} tool.
 */
public record ContactsRequest(Action action, String id, String search, String handle, ContactDraft draft) {

    public enum Action { SEARCH, RESOLVE, CREATE, UPDATE, DELETE }

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public ContactsRequest {
        if (action == null) {
            throw new ToolValidationException("action is required");
        }
        switch (action) {
            case SEARCH -> require(search, "Search term is required");
            case RESOLVE -> require(handle, "Handle is required");
            case CREATE -> {
                if (draft == null || !draft.hasName()) {
                    throw new ToolValidationException(
                            "At least one of firstName, lastName, or organization is required");
                }
            }
            case UPDATE, DELETE -> require(id, "Contact id is required");
        }
        if (draft != null && draft.email() != null && !EMAIL.matcher(draft.email()).matches()) {
            throw new ToolValidationException("Invalid email format");
        }
    }

    public static ContactsRequest from(Map<String, Object> params) {
        String rawAction = ToolInputs.requiredText(params, "action", ToolInputs.MAX_NAME_LENGTH, "action");
        Action action;
        try {
            action = Action.valueOf(rawAction.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ToolValidationException("Unknown contacts action: " + rawAction);
        }
        ContactDraft draft = null;
        if (action == Action.CREATE || action == Action.UPDATE) {
            draft = new ContactDraft(
                    ToolInputs.optionalText(params, "firstName", ToolInputs.MAX_TITLE_LENGTH, "First name"),
                    ToolInputs.optionalText(params, "lastName", ToolInputs.MAX_TITLE_LENGTH, "Last name"),
                    ToolInputs.optionalText(params, "organization", ToolInputs.MAX_TITLE_LENGTH, "Organization"),
                    ToolInputs.optionalText(params, "jobTitle", ToolInputs.MAX_TITLE_LENGTH, "Job title"),
                    ToolInputs.optionalText(params, "email", ToolInputs.MAX_TITLE_LENGTH, "Email"),
                    ToolInputs.optionalText(params, "phone", 50, "Phone"),
                    ToolInputs.optionalText(params, "note", ToolInputs.MAX_NOTE_LENGTH, "Note"));
        }
        return new ContactsRequest(
                action,
                ToolInputs.optionalText(params, "id", ToolInputs.MAX_ID_LENGTH, "Contact id"),
                ToolInputs.optionalText(params, "search", ToolInputs.MAX_SEARCH_LENGTH, "Search term"),
                ToolInputs.optionalText(params, "handle", ToolInputs.MAX_TITLE_LENGTH, "Handle"),
                draft);
    }

    private static void require(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ToolValidationException(message);
        }
    }
}
