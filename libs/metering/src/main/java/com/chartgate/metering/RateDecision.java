package com.chartgate.metering;

/**
 * Outcome of one {@link RateLimiter#allow} call.
 *
 * @param admitted          whether the request fits in the current window
 * @param retryAfterSeconds seconds until the window resets; 0 when admitted, at least 1 otherwise
 */
public record RateDecision(boolean admitted, long retryAfterSeconds) {

    private static final RateDecision ADMIT = new RateDecision(true, 0);

    public static RateDecision admit() {
        return ADMIT;
    }

    public static RateDecision throttled(long retryAfterSeconds) {
        return new RateDecision(false, Math.max(1, retryAfterSeconds));
    }
}
