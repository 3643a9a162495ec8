package com.chartgate.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private final HealthCheckRegistry registry = new HealthCheckRegistry(Clock.systemUTC());

    @Test
    @DisplayName("is healthy with no probes")
    void emptyIsHealthy() {
        assertThat(registry.checkAll().healthy()).isTrue();
        assertThat(registry.checkAll().checks()).isEmpty();
    }

    @Test
    @DisplayName("one failing probe makes the aggregate unhealthy")
    void failingProbe() {
        registry.register("accounts-store", () -> { })
                .register("usage-store", () -> {
                    throw new IllegalStateException("connection refused");
                });

        HealthResult result = registry.checkAll();

        assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(result.checks().get("accounts-store").status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.checks().get("usage-store").message()).isEqualTo("connection refused");
    }

    @Test
    @DisplayName("re-registering a name replaces the probe")
    void replacesProbe() {
        registry.register("usage-store", () -> {
            throw new IllegalStateException("down");
        });
        registry.register("usage-store", () -> { });

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.checkAll().healthy()).isTrue();
    }

    @Test
    @DisplayName("rejects blank names and null probes")
    void rejectsInvalidRegistration() {
        assertThatThrownBy(() -> registry.register(" ", () -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("x", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
