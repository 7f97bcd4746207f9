package com.contact.resolution.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An MCP (Model Context Protocol) tool exposed to the client: name,
 * description, JSON Schema of its arguments and the handler that runs it.
 *
 * <p>Handlers never throw. Failures come back as a result map with
 * {@code isError = true} and a {@code message}.</p>
 *
 * @param name        the tool name (e.g., "mail")
 * @param description a human-readable description of what the tool does
 * @param inputSchema the JSON Schema for the tool's input parameters
 * @param handler     receives the call arguments and returns the result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    /**
     * Runs the handler. A null argument map is treated as empty.
     */
    public Map<String, Object> call(Map<String, Object> arguments) {
        return handler.apply(arguments != null ? arguments : Map.of());
    }
}
