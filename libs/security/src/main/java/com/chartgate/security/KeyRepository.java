package com.chartgate.security;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of tenants, plans and API keys.
 * <p>
 * Implementations translate every storage failure into {@link StorageUnavailableException}.
 * Reads take no application-level locks; key creation and revocation are single-row writes.
 */
public interface KeyRepository {

    // ── API keys ──

    /**
     * Resolves a presented secret to its live key, tenant and plan.
     * <p>
     * A secret belonging to a revoked or expired key yields empty, exactly like an unknown
     * secret. The tenant's status is not filtered here; callers decide what a suspended tenant
     * means.
     */
    Optional<KeyMatch> findBySecret(String presentedSecret);

    /**
     * Creates a non-expiring key for a tenant.
     *
     * @throws IllegalArgumentException if the tenant does not exist
     */
    default CreatedKey createKey(String tenantId, String displayName) {
        return createKey(tenantId, displayName, null);
    }

    /**
     * Creates a key for a tenant.
     *
     * @param expiresAt optional expiry, null for none
     * @throws IllegalArgumentException if the tenant does not exist
     */
    CreatedKey createKey(String tenantId, String displayName, Instant expiresAt);

    /**
     * Revokes a key.
     *
     * @return true if a non-revoked key was revoked by this call
     */
    boolean revokeKey(String keyId);

    /**
     * Revokes a key only if it belongs to the given tenant.
     *
     * @return true if a non-revoked key owned by the tenant was revoked by this call
     */
    boolean revokeKey(String keyId, String tenantId);

    /** All keys of a tenant, newest first, revoked ones included. */
    List<ApiKey> listKeys(String tenantId);

    // ── Tenants ──

    /**
     * Registers a tenant in {@link TenantStatus#ACTIVE} state.
     *
     * @throws AccountExistsException   if the email is taken
     * @throws IllegalArgumentException if the plan does not exist
     */
    Tenant createTenant(String name, String email, String passwordHash, String planId);

    Optional<Tenant> getTenant(String tenantId);

    /** Looks up login credentials by email (case-insensitive). */
    Optional<TenantCredentials> findCredentialsByEmail(String email);

    /** All tenants, newest first. */
    List<Tenant> listTenants();

    /**
     * Moves a tenant to another plan. Applies to the tenant's next resolved request.
     *
     * @return the updated tenant, or empty if it does not exist
     * @throws IllegalArgumentException if the plan does not exist
     */
    Optional<Tenant> setPlan(String tenantId, String planId);

    /**
     * Changes a tenant's status.
     *
     * @return the updated tenant, or empty if it does not exist
     */
    Optional<Tenant> setStatus(String tenantId, TenantStatus status);

    // ── Plans ──

    Optional<Plan> getPlan(String planId);

    List<Plan> listPlans();
}
