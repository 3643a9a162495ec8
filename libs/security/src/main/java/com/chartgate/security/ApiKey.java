package com.chartgate.security;

import java.time.Instant;

/**
 * Stored metadata of an API key. The secret itself never appears here: storage keeps only a
 * salted hash, and the raw value is handed out once in {@link CreatedKey}.
 *
 * @param keyId     opaque unique identifier
 * @param tenantId  owning tenant
 * @param name      display name chosen at creation
 * @param keyPrefix first characters of the raw secret, for display and candidate lookup
 * @param createdAt creation time
 * @param expiresAt optional expiry
 * @param revokedAt revocation time, null while the key is live
 */
public record ApiKey(
        String keyId,
        String tenantId,
        String name,
        String keyPrefix,
        Instant createdAt,
        Instant expiresAt,
        Instant revokedAt
) {

    public boolean isRevoked() {
        return revokedAt != null;
    }

    /** Live means neither revoked nor expired at {@code now}. */
    public boolean isLive(Instant now) {
        return revokedAt == null && (expiresAt == null || now.isBefore(expiresAt));
    }
}
