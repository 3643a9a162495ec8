package com.chartgate.security;

/**
 * A request-rate ceiling: at most {@code limit} requests per {@code window}.
 * <p>
 * Written in configuration and in the {@code plans} table as {@code "<N>/<unit>"}, for example
 * {@code "60/minute"}.
 *
 * @param limit  requests admitted per window (positive)
 * @param window window granularity
 */
public record RateLimitSpec(long limit, RateWindow window) {

    public RateLimitSpec {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, was " + limit);
        }
        if (window == null) {
            throw new IllegalArgumentException("window must not be null");
        }
    }

    /**
     * Parses {@code "<N>/<unit>"} with unit one of second, minute, hour.
     *
     * @throws IllegalArgumentException if the text is null or not in that form
     */
    public static RateLimitSpec parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("rate limit must not be blank");
        }
        String[] parts = text.strip().split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("rate limit must look like '<N>/<unit>': " + text);
        }
        long limit;
        try {
            limit = Long.parseLong(parts[0].strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("rate limit count is not a number: " + text, e);
        }
        RateWindow window = RateWindow.fromUnit(parts[1].strip())
                .orElseThrow(() -> new IllegalArgumentException(
                        "rate limit unit must be second, minute or hour: " + text));
        return new RateLimitSpec(limit, window);
    }

    /** Canonical {@code "<N>/<unit>"} form, as stored. */
    public String format() {
        return limit + "/" + window.unitName();
    }

    @Override
    public String toString() {
        return format();
    }
}
