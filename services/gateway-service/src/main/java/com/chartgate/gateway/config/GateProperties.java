package com.chartgate.gateway.config;

import com.chartgate.security.AuthSettings;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gate limits, bound from {@code chartgate.gate.*}.
 *
 * @param apiKeys                  comma-separated static fallback keys; empty enables dev mode
 * @param defaultRateLimit         rate limit for static keys, {@code "<N>/<unit>"}
 * @param quotaLease               how long an admitted request holds quota before it is settled
 * @param rateLimiterMaxIdentities cap on identities tracked by the rate limiter
 */
@ConfigurationProperties(prefix = "chartgate.gate")
@Validated
public record GateProperties(
        String apiKeys,
        @NotBlank String defaultRateLimit,
        Duration quotaLease,
        long rateLimiterMaxIdentities) {

    public GateProperties {
        if (apiKeys == null) {
            apiKeys = "";
        }
        if (defaultRateLimit == null || defaultRateLimit.isBlank()) {
            defaultRateLimit = "60/minute";
        }
        if (quotaLease == null) {
            quotaLease = Duration.ofMinutes(15);
        }
        if (rateLimiterMaxIdentities <= 0) {
            rateLimiterMaxIdentities = 100_000;
        }
    }

    /** Parses the key list and default rate into the resolver's immutable settings. */
    public AuthSettings toAuthSettings() {
        return AuthSettings.of(apiKeys, defaultRateLimit);
    }
}
