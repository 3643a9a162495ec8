package com.chartgate.security;

/**
 * Every way the gate can turn a request away.
 * <p>
 * Each reason maps to exactly one HTTP status and a stable problem-type slug, so clients can
 * branch on the slug rather than on message text. {@link #QUOTA_EXCEEDED} and {@link #THROTTLED}
 * share 429 but differ in slug and retryability: a throttled client retries after
 * {@code Retry-After}, a quota-exhausted client waits for the next billing period.
 */
public enum RejectionReason {

    UNAUTHORIZED(401, "unauthorized", false),
    INVALID_TOKEN(401, "invalid-token", false),
    EXPIRED_TOKEN(401, "expired-token", false),
    TENANT_SUSPENDED(403, "tenant-suspended", false),
    THROTTLED(429, "throttled", true),
    QUOTA_EXCEEDED(429, "quota-exceeded", false),
    STORAGE_UNAVAILABLE(503, "storage-unavailable", false);

    private final int httpStatus;
    private final String slug;
    private final boolean retryable;

    RejectionReason(int httpStatus, String slug, boolean retryable) {
        this.httpStatus = httpStatus;
        this.slug = slug;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Stable identifier used in problem-type URIs and metric tags. */
    public String slug() {
        return slug;
    }

    /** Whether a client may retry automatically within the same billing period. */
    public boolean retryable() {
        return retryable;
    }
}
