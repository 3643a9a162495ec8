package com.chartgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns a presented API key into a {@link TenantContext}.
 * <p>
 * Strategies run in a fixed order and the first one that admits wins:
 * <ol>
 *   <li>{@link SaasKeyStrategy}: live tenant key from the accounts store</li>
 *   <li>{@link StaticKeyStrategy}: configured fallback key</li>
 *   <li>{@link DevModeStrategy}: only when no fallback keys are configured</li>
 * </ol>
 * If none admits, the request is unauthorized. Exceptions thrown by a strategy (suspended
 * tenant, storage outage) propagate unchanged and later strategies do not run.
 */
public final class AuthResolver {

    private static final Logger log = LoggerFactory.getLogger(AuthResolver.class);

    private final List<ResolutionStrategy> chain;

    /**
     * Builds the standard three-step chain.
     */
    public AuthResolver(KeyRepository keys, AuthSettings settings) {
        this(List.of(
                new SaasKeyStrategy(keys),
                new StaticKeyStrategy(settings),
                new DevModeStrategy(settings)));
        if (settings.devModeAllowed()) {
            log.warn("No static API keys configured: unmatched requests are admitted in dev mode");
        }
    }

    /**
     * Builds a resolver over an explicit chain, tried in list order.
     */
    public AuthResolver(List<ResolutionStrategy> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("chain must contain at least one strategy");
        }
        this.chain = List.copyOf(chain);
    }

    /**
     * Resolves a credential.
     *
     * @param credential the API key header value, null or empty when absent
     * @return the resolved context
     * @throws UnauthorizedException       if no strategy admits the credential
     * @throws TenantSuspendedException    if the key's tenant is suspended
     * @throws StorageUnavailableException if the accounts store fails
     */
    public TenantContext resolve(String credential) {
        for (ResolutionStrategy strategy : chain) {
            Optional<TenantContext> context = strategy.attempt(credential);
            if (context.isPresent()) {
                log.debug("Resolved caller via {}", context.get().authSource().value());
                return context.get();
            }
        }
        if (credential == null || credential.isEmpty()) {
            throw new UnauthorizedException("Missing API key. Provide the X-API-Key header.");
        }
        throw new UnauthorizedException("Invalid API key.");
    }
}
