package com.chartgate.security;

import java.util.Optional;

/**
 * One credential source in the {@link AuthResolver} chain.
 * <p>
 * Returns a context when this source admits the credential, empty to let the next source try.
 * Throwing ends the chain: a {@link GateRejectedException} is the final answer for the request.
 */
@FunctionalInterface
public interface ResolutionStrategy {

    /**
     * @param credential the presented API key, or null when none was sent
     */
    Optional<TenantContext> attempt(String credential);
}
