package com.contact.resolution.mcp;

import java.util.Map;

/**
 * Reads and validates tool arguments. Text is limited in length and may not
 * contain control characters other than tab, newline and carriage return.
 */
public final class ToolInputs {

    public static final int MAX_ID_LENGTH = 200;
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_SEARCH_LENGTH = 100;
    public static final int MAX_NOTE_LENGTH = 2000;

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private ToolInputs() {
        // utility class
    }

    public static String requiredText(Map<String, Object> params, String key, int maxLength, String fieldName) {
        String value = optionalText(params, key, maxLength, fieldName);
        if (value == null || value.isBlank()) {
            throw new ToolValidationException(fieldName + " is required");
        }
        return value;
    }

    /**
     * Returns the text argument, or {@code null} when it is absent.
     */
    public static String optionalText(Map<String, Object> params, String key, int maxLength, String fieldName) {
        Object raw = params.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String value)) {
            throw new ToolValidationException(fieldName + " must be a string");
        }
        checkText(value, maxLength, fieldName);
        return value;
    }

    public static boolean optionalBoolean(Map<String, Object> params, String key, boolean defaultValue) {
        Object raw = params.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new ToolValidationException(key + " must be a boolean");
    }

    public static Integer optionalInt(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new ToolValidationException(key + " must be an integer");
            }
            return number.intValue();
        }
        if (raw instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolValidationException(key + " must be an integer");
            }
        }
        throw new ToolValidationException(key + " must be an integer");
    }

    public static int limit(Integer limit) {
        int value = limit != null ? limit : DEFAULT_LIMIT;
        if (value < 1 || value > MAX_LIMIT) {
            throw new ToolValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        return value;
    }

    public static int offset(Integer offset) {
        int value = offset != null ? offset : 0;
        if (value < 0) {
            throw new ToolValidationException("offset must be >= 0");
        }
        return value;
    }

    public static void checkText(String value, int maxLength, String fieldName) {
        if (value.length() > maxLength) {
            throw new ToolValidationException(fieldName + " cannot exceed " + maxLength + " characters");
        }
        if (containsControlCharacters(value)) {
            throw new ToolValidationException(fieldName + " contains invalid characters");
        }
    }

    /**
     * C0 controls except tab, newline and carriage return; DEL; C1 controls.
     */
    static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c >= 0x7F && c <= 0x9F) {
                return true;
            }
        }
        return false;
    }
}
