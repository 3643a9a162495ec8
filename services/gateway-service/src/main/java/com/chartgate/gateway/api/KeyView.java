package com.chartgate.gateway.api;

import com.chartgate.security.ApiKey;
import java.time.Instant;

/**
 * Key metadata; only the prefix of the secret is ever shown.
 */
public record KeyView(
        String id,
        String name,
        String keyPrefix,
        Instant createdAt,
        Instant expiresAt,
        Instant revokedAt,
        boolean revoked) {

    static KeyView from(ApiKey key) {
        return new KeyView(
                key.keyId(),
                key.name(),
                key.keyPrefix(),
                key.createdAt(),
                key.expiresAt(),
                key.revokedAt(),
                key.isRevoked());
    }
}
