package com.chartgate.metering;

import com.chartgate.security.GateRejectedException;
import com.chartgate.security.RejectionReason;

/**
 * The tenant has no quota left in the current billing period. Not retryable before the period
 * ends or the plan changes.
 */
public class QuotaExceededException extends GateRejectedException {

    private final String tenantId;
    private final long monthlyQuota;
    private final BillingPeriod period;

    public QuotaExceededException(String tenantId, long monthlyQuota, BillingPeriod period) {
        super(RejectionReason.QUOTA_EXCEEDED,
                "Monthly quota of " + monthlyQuota + " requests exhausted for " + period.id() + ".");
        this.tenantId = tenantId;
        this.monthlyQuota = monthlyQuota;
        this.period = period;
    }

    public String tenantId() {
        return tenantId;
    }

    public long monthlyQuota() {
        return monthlyQuota;
    }

    public BillingPeriod period() {
        return period;
    }
}
