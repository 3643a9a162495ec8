package com.chartgate.security;

import java.time.Instant;

/**
 * A billed account.
 *
 * @param tenantId  opaque unique identifier
 * @param name      account display name
 * @param email     login email, stored lower-cased
 * @param planId    current plan
 * @param status    lifecycle state
 * @param createdAt registration time
 */
public record Tenant(
        String tenantId,
        String name,
        String email,
        String planId,
        TenantStatus status,
        Instant createdAt
) {

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }
}
