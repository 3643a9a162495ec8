package com.chartgate.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach logs or API responses.
 * <p>
 * Two shapes are handled: a single secret value ({@link #mask}), which keeps a short prefix so
 * operators can tell keys apart, and a map of header/field names ({@link #redact}), where values
 * under a sensitive name are replaced outright. Name matching is case-insensitive and substring
 * based, so {@code X-API-Key} and {@code apiKey} both match {@code api-key}/{@code apikey}.
 */
public final class CredentialRedactor {

    /** Replacement for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Characters of a secret kept by {@link #mask}. */
    public static final int VISIBLE_PREFIX = 8;

    private static final Set<String> SENSITIVE_NAMES = Set.of(
            "password", "token", "secret", "authorization", "api-key", "apikey", "credential"
    );

    private static final Pattern SENSITIVE_NAME = Pattern.compile(
            String.join("|", SENSITIVE_NAMES.stream().map(Pattern::quote).toList()),
            Pattern.CASE_INSENSITIVE);

    /**
     * Masks a secret, keeping the first {@value #VISIBLE_PREFIX} characters.
     * Secrets shorter than that are fully hidden.
     *
     * @return {@code "abcd1234..."}, {@code "***"} for short values, or {@code "-"} for null/blank
     */
    public String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "-";
        }
        if (secret.length() < VISIBLE_PREFIX) {
            return "***";
        }
        return secret.substring(0, VISIBLE_PREFIX) + "...";
    }

    /**
     * Returns a copy of the map with values under sensitive names replaced by {@value #REDACTED}.
     * Null input yields an empty map.
     */
    public Map<String, String> redact(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(fields.size());
        fields.forEach((name, value) -> result.put(name, isSensitive(name) ? REDACTED : value));
        return result;
    }

    /** Whether a header or field name carries a credential. */
    public boolean isSensitive(String name) {
        return name != null && SENSITIVE_NAME.matcher(name).find();
    }
}
