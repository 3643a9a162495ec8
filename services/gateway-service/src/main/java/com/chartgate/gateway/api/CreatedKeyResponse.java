package com.chartgate.gateway.api;

import com.chartgate.security.CreatedKey;

/**
 * A freshly created key. {@code key} is the raw secret and is shown this one time only.
 */
public record CreatedKeyResponse(String id, String name, String keyPrefix, String key) {

    static CreatedKeyResponse from(CreatedKey created) {
        return new CreatedKeyResponse(
                created.apiKey().keyId(),
                created.apiKey().name(),
                created.apiKey().keyPrefix(),
                created.rawSecret());
    }

    @Override
    public String toString() {
        return "CreatedKeyResponse[id=" + id + ", name=" + name + ", keyPrefix=" + keyPrefix + "]";
    }
}
