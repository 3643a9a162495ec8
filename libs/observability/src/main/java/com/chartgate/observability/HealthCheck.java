package com.chartgate.observability;

/**
 * A lightweight probe of one dependency.
 * <p>
 * Implementations return normally when the dependency answered and throw when it did not; the
 * {@link HealthCheckRegistry} turns either outcome into a {@link ComponentHealth} with timing.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Probes the dependency.
     *
     * @throws Exception if the dependency is unreachable or misbehaving
     */
    void probe() throws Exception;
}
