package com.chartgate.gateway.api;

import com.chartgate.security.Plan;

/**
 * Plan limits in their configuration form ({@code "10/minute"}).
 */
public record PlanView(String planId, String name, String rateLimit, Long monthlyQuota) {

    static PlanView from(Plan plan) {
        return new PlanView(
                plan.planId(),
                plan.name(),
                plan.isRateLimited() ? plan.rateLimit().format() : null,
                plan.monthlyQuota());
    }
}
