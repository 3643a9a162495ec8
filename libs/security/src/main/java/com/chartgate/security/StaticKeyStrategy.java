package com.chartgate.security;

import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Admits members of the statically configured key list with the default fallback plan.
 * <p>
 * Keys are held as SHA-256 digests and every entry is compared, so the time taken does not
 * depend on which key (if any) matched.
 */
public final class StaticKeyStrategy implements ResolutionStrategy {

    private final List<byte[]> keyDigests;
    private final Plan fallbackPlan;

    public StaticKeyStrategy(AuthSettings settings) {
        this.keyDigests = settings.staticKeys().stream().map(SecretHasher::sha256).toList();
        this.fallbackPlan = Plan.envFallback(settings.defaultRateLimit());
    }

    @Override
    public Optional<TenantContext> attempt(String credential) {
        if (credential == null || credential.isEmpty() || keyDigests.isEmpty()) {
            return Optional.empty();
        }
        byte[] presented = SecretHasher.sha256(credential);
        boolean matched = false;
        for (byte[] digest : keyDigests) {
            matched |= MessageDigest.isEqual(digest, presented);
        }
        return matched
                ? Optional.of(TenantContext.forStaticKey(credential, fallbackPlan))
                : Optional.empty();
    }
}
