package com.chartgate.security;

/**
 * Which credential source admitted a caller.
 */
public enum AuthSource {

    /** A tenant key found in the accounts store. */
    SAAS_DB("saas_db"),

    /** A key from the statically configured allow-list. */
    ENV_FALLBACK("env_fallback"),

    /** No static keys configured and no tenant key matched. */
    DEV_MODE("dev_mode");

    private final String value;

    AuthSource(String value) {
        this.value = value;
    }

    /** Snake-case value used in logs, metric tags and responses. */
    public String value() {
        return value;
    }
}
