package com.chartgate.gateway.gate;

import com.chartgate.security.TenantContext;

/**
 * Handler run by {@link Gate#execute} once the caller has been admitted.
 *
 * @param <T> handler result
 */
@FunctionalInterface
public interface GatedCall<T> {

    /**
     * Produces the side effect usage is charged for. Returning normally means the side effect
     * happened; throwing means it did not.
     */
    T call(TenantContext context) throws Exception;
}
