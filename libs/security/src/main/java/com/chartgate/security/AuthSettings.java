package com.chartgate.security;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable authentication configuration handed to {@link AuthResolver} at construction.
 *
 * @param staticKeys       fallback API keys; empty means dev mode is allowed
 * @param defaultRateLimit rate limit applied to static fallback keys
 */
public record AuthSettings(Set<String> staticKeys, RateLimitSpec defaultRateLimit) {

    public AuthSettings {
        staticKeys = Set.copyOf(staticKeys);
        if (defaultRateLimit == null) {
            throw new IllegalArgumentException("defaultRateLimit must not be null");
        }
    }

    /**
     * Builds settings from the configuration strings: a comma-separated key list (blank entries
     * dropped, whitespace trimmed) and a {@code "<N>/<unit>"} default rate.
     */
    public static AuthSettings of(String commaSeparatedKeys, String defaultRateLimit) {
        Set<String> keys = new LinkedHashSet<>();
        if (commaSeparatedKeys != null) {
            Arrays.stream(commaSeparatedKeys.split(","))
                    .map(String::strip)
                    .filter(k -> !k.isEmpty())
                    .forEach(keys::add);
        }
        return new AuthSettings(keys, RateLimitSpec.parse(defaultRateLimit));
    }

    public boolean devModeAllowed() {
        return staticKeys.isEmpty();
    }

    @Override
    public String toString() {
        return "AuthSettings[staticKeys=" + staticKeys.size() + ", defaultRateLimit="
                + defaultRateLimit + "]";
    }
}
