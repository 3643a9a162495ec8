package com.chartgate.observability;

/**
 * Immutable correlation context for one inbound request.
 * <p>
 * Established by the HTTP filter before authentication runs, then enriched once the gate has
 * resolved who is calling. Every field is mirrored into SLF4J MDC by
 * {@link CorrelationContextHolder} so log lines carry the caller without each log statement
 * having to mention it.
 *
 * @param correlationId propagated or generated request correlation ID (never blank)
 * @param requestId     unique ID for this specific request (nullable)
 * @param tenantId      resolved tenant (nullable until resolution, and for tenant-less callers)
 * @param authSource    which credential source admitted the caller (nullable until resolution)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String tenantId,
        String authSource
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the credential source. */
    public static final String MDC_AUTH_SOURCE = "authSource";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context for a request that has not been authenticated yet. */
    public static CorrelationContext of(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null);
    }

    /**
     * Returns a copy carrying the resolved caller.
     *
     * @param tenantId   tenant ID, or null for env-fallback and dev-mode callers
     * @param authSource credential source name
     */
    public CorrelationContext withCaller(String tenantId, String authSource) {
        return new CorrelationContext(correlationId, requestId, tenantId, authSource);
    }
}
