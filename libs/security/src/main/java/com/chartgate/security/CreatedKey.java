package com.chartgate.security;

/**
 * Result of key creation: the stored metadata plus the raw secret, which cannot be retrieved again.
 *
 * @param apiKey    stored metadata
 * @param rawSecret the secret to give to the caller exactly once
 */
public record CreatedKey(ApiKey apiKey, String rawSecret) {

    @Override
    public String toString() {
        return "CreatedKey[keyId=" + apiKey.keyId() + ", prefix=" + apiKey.keyPrefix() + "]";
    }
}
