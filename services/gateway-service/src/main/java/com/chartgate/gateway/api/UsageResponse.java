package com.chartgate.gateway.api;

import com.chartgate.metering.UsageRecord;
import com.chartgate.security.Plan;
import com.chartgate.security.TenantContext;
import java.util.List;

/**
 * Current-period usage of a caller with its recent history. Tenant callers are reported by tenant
 * and against their quota; static-key and dev-mode callers by key fingerprint, without a quota.
 *
 * @param tenantId     tenant, null for tenant-less callers
 * @param usageKey     counter the usage is recorded under
 * @param authSource   how the caller was resolved
 * @param planId       effective plan
 * @param metered      whether usage counts against a monthly quota
 * @param current      the current period
 * @param monthlyQuota the plan's quota, null when unbounded
 * @param remaining    quota left in the current period, null when unbounded or not metered
 * @param history      most recent periods first
 */
public record UsageResponse(
        String tenantId,
        String usageKey,
        String authSource,
        String planId,
        boolean metered,
        UsagePeriodView current,
        Long monthlyQuota,
        Long remaining,
        List<UsagePeriodView> history) {

    static UsageResponse of(TenantContext context, UsageRecord current, List<UsageRecord> history) {
        Plan plan = context.plan();
        Long remaining = context.isMetered() && plan.hasQuota()
                ? Math.max(0, plan.monthlyQuota() - current.count())
                : null;
        return new UsageResponse(
                context.tenantId(),
                context.usageKey(),
                context.authSource().value(),
                plan.planId(),
                context.isMetered(),
                UsagePeriodView.from(current),
                plan.monthlyQuota(),
                remaining,
                history.stream().map(UsagePeriodView::from).toList());
    }
}
