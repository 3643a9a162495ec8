package com.chartgate.observability;

/**
 * Health of a single store probe or of the service as a whole.
 */
public enum HealthStatus {

    /** Probe succeeded. */
    HEALTHY,

    /** Probe failed or timed out; {@code /health} then answers 503. */
    UNHEALTHY
}
