package com.contact.resolution.source;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A request for the OS automation layer: which app to drive, which prepared
 * operation to run, its parameters and how long the layer may take.
 *
 * @param app       target application, e.g. {@code "Contacts"}
 * @param operation name of the prepared automation operation
 * @param params    operation parameters, passed through unescaped
 * @param timeout   execution budget for the automation layer
 */
public record AutomationRequest(String app, String operation, Map<String, String> params, Duration timeout) {

    public AutomationRequest {
        Objects.requireNonNull(app, "app is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
