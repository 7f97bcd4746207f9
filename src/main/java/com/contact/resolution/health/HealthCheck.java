package com.contact.resolution.health;

/**
 * A single component check contributing to {@link HealthCheckRegistry#checkAll()}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
