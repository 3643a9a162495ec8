package com.chartgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Account session tokens, bound from {@code chartgate.session.*}.
 *
 * @param secret HMAC secret, at least 32 characters
 * @param ttl    token lifetime, 24 hours when unset
 */
@ConfigurationProperties(prefix = "chartgate.session")
@Validated
public record SessionProperties(@NotBlank @Size(min = 32) String secret, Duration ttl) {

    public SessionProperties {
        if (ttl == null) {
            ttl = Duration.ofHours(24);
        }
    }

    @Override
    public String toString() {
        return "SessionProperties[secret=[REDACTED], ttl=" + ttl + "]";
    }
}
