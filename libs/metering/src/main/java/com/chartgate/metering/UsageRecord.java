package com.chartgate.metering;

import java.time.Instant;

/**
 * Completed-request count of one tenant in one billing period.
 *
 * @param tenantId tenant
 * @param period   billing period
 * @param count    confirmed completions; never decreases within a period
 */
public record UsageRecord(String tenantId, BillingPeriod period, long count) {

    public static UsageRecord empty(String tenantId, BillingPeriod period) {
        return new UsageRecord(tenantId, period, 0);
    }

    public Instant periodStart() {
        return period.start();
    }

    public Instant periodEnd() {
        return period.end();
    }
}
