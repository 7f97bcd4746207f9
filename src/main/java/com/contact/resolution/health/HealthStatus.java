package com.contact.resolution.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component or of the whole resolver, with free-form details.
 * {@link Status} constants are ordered from best to worst.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.ordinal() > other.status.ordinal();
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(details);
        newDetails.put(key, value);
        return new HealthStatus(status, message, newDetails);
    }
}
