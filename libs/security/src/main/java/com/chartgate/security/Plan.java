package com.chartgate.security;

/**
 * A named limit profile.
 *
 * @param planId       stable identifier (e.g., "free")
 * @param name         display name
 * @param rateLimit    short-window ceiling, or null when the plan is not rate limited
 * @param monthlyQuota requests per billing period, or null for unbounded
 */
public record Plan(String planId, String name, RateLimitSpec rateLimit, Long monthlyQuota) {

    /** Plan identifier given to callers admitted through the static key list. */
    public static final String ENV_FALLBACK_PLAN_ID = "env-fallback";

    /** Plan identifier given to callers admitted in dev mode. */
    public static final String UNRESTRICTED_PLAN_ID = "unrestricted";

    public Plan {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("planId must not be null or blank");
        }
        if (monthlyQuota != null && monthlyQuota < 0) {
            throw new IllegalArgumentException("monthlyQuota must be >= 0");
        }
    }

    /** Default plan for static fallback keys: configured rate, no quota. */
    public static Plan envFallback(RateLimitSpec defaultRateLimit) {
        return new Plan(ENV_FALLBACK_PLAN_ID, "Static key", defaultRateLimit, null);
    }

    /** No rate limit and no quota. */
    public static Plan unrestricted() {
        return new Plan(UNRESTRICTED_PLAN_ID, "Development", null, null);
    }

    public boolean isRateLimited() {
        return rateLimit != null;
    }

    public boolean hasQuota() {
        return monthlyQuota != null;
    }
}
