package com.chartgate.gateway.api;

import com.chartgate.metering.UsageRecord;
import java.time.Instant;

/**
 * One billing period of a tenant's usage.
 */
public record UsagePeriodView(String period, Instant periodStart, Instant periodEnd, long requestCount) {

    static UsagePeriodView from(UsageRecord record) {
        return new UsagePeriodView(
                record.period().id(), record.periodStart(), record.periodEnd(), record.count());
    }
}
