package com.chartgate.security;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Window granularity of a {@link RateLimitSpec}.
 */
public enum RateWindow {

    SECOND(Duration.ofSeconds(1)),
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1));

    private final Duration length;

    RateWindow(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }

    /** Lower-case unit name as written in limit strings ("minute"). */
    public String unitName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a window by unit name, case-insensitively.
     */
    public static Optional<RateWindow> fromUnit(String unit) {
        for (RateWindow window : values()) {
            if (window.unitName().equalsIgnoreCase(unit)) {
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }
}
