package com.chartgate.security;

import java.util.Optional;

/**
 * Resolves tenant keys from the accounts store. First in the chain, so a provisioned tenant key
 * wins over an identical static key.
 */
public final class SaasKeyStrategy implements ResolutionStrategy {

    private final KeyRepository keys;

    public SaasKeyStrategy(KeyRepository keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys must not be null");
        }
        this.keys = keys;
    }

    /**
     * @throws TenantSuspendedException    if the key is live but its tenant is suspended
     * @throws StorageUnavailableException if the accounts store fails; never swallowed
     */
    @Override
    public Optional<TenantContext> attempt(String credential) {
        if (credential == null || credential.isEmpty()) {
            return Optional.empty();
        }
        Optional<KeyMatch> match = keys.findBySecret(credential);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        Tenant tenant = match.get().tenant();
        if (!tenant.isActive()) {
            throw new TenantSuspendedException(tenant.tenantId());
        }
        return Optional.of(TenantContext.forTenantKey(match.get()));
    }
}
