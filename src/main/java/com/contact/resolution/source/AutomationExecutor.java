package com.contact.resolution.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Runs prepared automation operations against native desktop apps.
 * Supplied by the host; this library only consumes its parsed JSON output.
 *
 * <p>Failures complete the future with an {@link AutomationException}.</p>
 */
@FunctionalInterface
public interface AutomationExecutor {

    CompletableFuture<JsonNode> execute(AutomationRequest request);
}
