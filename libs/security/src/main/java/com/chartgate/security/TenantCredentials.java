package com.chartgate.security;

/**
 * A tenant together with its stored password hash, for account login only.
 *
 * @param tenant       the tenant
 * @param passwordHash encoded password hash (BCrypt)
 */
public record TenantCredentials(Tenant tenant, String passwordHash) {

    @Override
    public String toString() {
        return "TenantCredentials[tenant=" + tenant.tenantId() + ", passwordHash=[REDACTED]]";
    }
}
