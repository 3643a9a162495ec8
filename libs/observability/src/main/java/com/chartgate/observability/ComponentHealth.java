package com.chartgate.observability;

/**
 * Outcome of one health probe.
 *
 * @param name      component name (e.g., "accounts-store", "usage-store")
 * @param status    probe outcome
 * @param message   failure detail, null when healthy
 * @param latencyMs time the probe took
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
