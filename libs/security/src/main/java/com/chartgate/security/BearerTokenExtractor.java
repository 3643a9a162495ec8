package com.chartgate.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() < SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)) {
            return Optional.empty();
        }
        String rest = trimmed.substring(SCHEME.length());
        // "Bearerabc" is a different scheme, not a token
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            return Optional.empty();
        }
        String token = rest.strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
