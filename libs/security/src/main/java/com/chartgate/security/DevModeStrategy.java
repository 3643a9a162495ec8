package com.chartgate.security;

import java.util.Optional;

/**
 * Admits everything when the operator configured no static keys. Last in the chain; with any
 * static key configured it never admits, so a wrong key cannot degrade into dev mode.
 */
public final class DevModeStrategy implements ResolutionStrategy {

    private final boolean enabled;

    public DevModeStrategy(AuthSettings settings) {
        this.enabled = settings.devModeAllowed();
    }

    @Override
    public Optional<TenantContext> attempt(String credential) {
        return enabled ? Optional.of(TenantContext.forDevMode(credential)) : Optional.empty();
    }
}
