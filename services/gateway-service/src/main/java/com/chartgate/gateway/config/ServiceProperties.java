package com.chartgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code chartgate.service.*}.
 *
 * <pre>
 * chartgate:
 *   service:
 *     name: chartgate-gateway
 *     environment: production
 *     version: 0.1.0
 * </pre>
 *
 * @param name        service name for logs, metrics and the root info endpoint
 * @param environment deployment environment, "development" when unset
 * @param version     reported version, "unknown" when unset
 */
@ConfigurationProperties(prefix = "chartgate.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String version) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (version == null || version.isBlank()) {
            version = "unknown";
        }
    }
}
