package com.gene.evidence.api;

import com.gene.evidence.health.HealthStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Tier availability plus aggregate health.
 */
public record ServiceStatus(
        String service,
        Map<String, TierAvailability> tiers,
        Map<String, Object> genomeSummary,
        HealthStatus health,
        Instant loadedAt
) {
}
