package com.chartgate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs registered {@link HealthCheck} probes and aggregates them into one {@link HealthResult}.
 * <p>
 * Probes run sequentially on the calling thread. The set of probes is fixed at wiring time (one
 * per durable store), so registration is not thread-safe and must finish before the first call
 * to {@link #checkAll()}.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final Clock clock;

    public HealthCheckRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Registers a probe under a component name, replacing any previous probe of that name.
     */
    public HealthCheckRegistry register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
        return this;
    }

    /**
     * Runs every probe. With no probes registered the result is HEALTHY.
     */
    public HealthResult checkAll() {
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;

        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            String name = entry.getKey();
            long start = clock.millis();
            ComponentHealth result;
            try {
                entry.getValue().probe();
                result = ComponentHealth.healthy(name, clock.millis() - start);
            } catch (Exception e) {
                log.warn("Health probe {} failed: {}", name, e.getMessage());
                result = ComponentHealth.unhealthy(name, e.getMessage(), clock.millis() - start);
                overall = HealthStatus.UNHEALTHY;
            }
            results.put(name, result);
        }
        return new HealthResult(overall, results, clock.instant());
    }

    public int size() {
        return checks.size();
    }
}
