package com.chartgate.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of all registered probes.
 *
 * @param status    UNHEALTHY if any probe failed
 * @param checks    per-component results keyed by name, in registration order
 * @param timestamp when the probes ran
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    public boolean healthy() {
        return status == HealthStatus.HEALTHY;
    }
}
