package com.chartgate.metering;

import com.chartgate.security.GateRejectedException;
import com.chartgate.security.RejectionReason;

/**
 * The caller exceeded its short-window rate limit. Retryable after {@link #retryAfterSeconds()}.
 */
public class ThrottledException extends GateRejectedException {

    private final long retryAfterSeconds;

    public ThrottledException(RateDecision decision) {
        super(RejectionReason.THROTTLED,
                "Rate limit exceeded. Retry in " + decision.retryAfterSeconds() + "s.");
        this.retryAfterSeconds = decision.retryAfterSeconds();
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
