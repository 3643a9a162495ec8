package com.chartgate.security;

/**
 * The credential is valid but its tenant has been suspended by an operator.
 */
public class TenantSuspendedException extends GateRejectedException {

    private final String tenantId;

    public TenantSuspendedException(String tenantId) {
        super(RejectionReason.TENANT_SUSPENDED, "Tenant '%s' is suspended".formatted(tenantId));
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
