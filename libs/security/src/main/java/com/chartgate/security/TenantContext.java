package com.chartgate.security;

/**
 * Who is calling and under which limits, resolved afresh for every request.
 *
 * @param tenantId          resolved tenant, null for env-fallback and dev-mode callers
 * @param plan              effective limits
 * @param authSource        credential source that admitted the caller
 * @param keyId             matched key, null unless {@code authSource} is SAAS_DB
 * @param rateLimitIdentity key under which the caller's rate counter is kept
 */
public record TenantContext(
        String tenantId,
        Plan plan,
        AuthSource authSource,
        String keyId,
        String rateLimitIdentity
) {

    /** Identity used in dev mode when no credential was presented at all. */
    public static final String ANONYMOUS_IDENTITY = "dev:anonymous";

    public TenantContext {
        if (plan == null) {
            throw new IllegalArgumentException("plan must not be null");
        }
        if (authSource == null) {
            throw new IllegalArgumentException("authSource must not be null");
        }
        if (rateLimitIdentity == null || rateLimitIdentity.isBlank()) {
            throw new IllegalArgumentException("rateLimitIdentity must not be null or blank");
        }
    }

    /**
     * Context for a tenant key. All keys of one tenant share the tenant's rate counter.
     */
    public static TenantContext forTenantKey(KeyMatch match) {
        String tenantId = match.tenant().tenantId();
        return new TenantContext(
                tenantId, match.plan(), AuthSource.SAAS_DB, match.apiKey().keyId(),
                "tenant:" + tenantId);
    }

    /** Context for a static fallback key; rate counted per key. */
    public static TenantContext forStaticKey(String credential, Plan fallbackPlan) {
        return new TenantContext(
                null, fallbackPlan, AuthSource.ENV_FALLBACK, null, credentialIdentity(credential));
    }

    /** Context for dev mode, with or without a credential. */
    public static TenantContext forDevMode(String credential) {
        String identity = credential == null || credential.isEmpty()
                ? ANONYMOUS_IDENTITY
                : credentialIdentity(credential);
        return new TenantContext(null, Plan.unrestricted(), AuthSource.DEV_MODE, null, identity);
    }

    /** Whether usage is metered against a tenant's monthly quota. */
    public boolean isMetered() {
        return tenantId != null;
    }

    /**
     * Counter the caller's usage is recorded under: the tenant, or for tenant-less callers the
     * same per-key identity their rate window uses.
     */
    public String usageKey() {
        return tenantId != null ? tenantId : rateLimitIdentity;
    }

    private static String credentialIdentity(String credential) {
        return "key:" + SecretHasher.fingerprint(credential);
    }
}
