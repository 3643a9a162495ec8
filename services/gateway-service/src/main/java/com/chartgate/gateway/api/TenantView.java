package com.chartgate.gateway.api;

import com.chartgate.security.Plan;
import com.chartgate.security.Tenant;
import java.time.Instant;

/**
 * Tenant as shown to its owner and to operators. Never carries the password hash.
 */
public record TenantView(
        String id,
        String name,
        String email,
        String planId,
        String planName,
        String status,
        Instant createdAt) {

    static TenantView from(Tenant tenant, Plan plan) {
        return new TenantView(
                tenant.tenantId(),
                tenant.name(),
                tenant.email(),
                tenant.planId(),
                plan != null ? plan.name() : null,
                tenant.status().value(),
                tenant.createdAt());
    }
}
