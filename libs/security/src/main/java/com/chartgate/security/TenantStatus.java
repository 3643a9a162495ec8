package com.chartgate.security;

import java.util.Locale;

/**
 * Tenant lifecycle state. Only operators move a tenant between states.
 */
public enum TenantStatus {

    ACTIVE,
    SUSPENDED;

    /** Lower-case value as stored in the {@code tenants.status} column. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything but "active" or "suspended" (any case)
     */
    public static TenantStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        for (TenantStatus status : values()) {
            if (status.value().equalsIgnoreCase(value.strip())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown tenant status: " + value);
    }
}
