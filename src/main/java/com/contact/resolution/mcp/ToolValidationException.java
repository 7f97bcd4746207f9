package com.contact.resolution.mcp;

/**
 * Invalid tool arguments. The message is shown to the client unchanged.
 */
public class ToolValidationException extends IllegalArgumentException {

    public ToolValidationException(String message) {
        super(message);
    }
}
