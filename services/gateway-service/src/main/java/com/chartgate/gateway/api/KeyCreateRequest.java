package com.chartgate.gateway.api;

import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Key creation input; both fields optional.
 *
 * @param name      display name, "Default" when omitted
 * @param expiresAt optional expiry
 */
public record KeyCreateRequest(@Size(max = 100) String name, Instant expiresAt) {

    public static final String DEFAULT_NAME = "Default";

    public KeyCreateRequest {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
    }
}
