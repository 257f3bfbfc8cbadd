package com.gene.evidence.health;

/**
 * A single component check reported through the status endpoint.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
