package com.chartgate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Operator credentials, bound from {@code chartgate.admin.*}. Admin endpoints answer 503 until
 * both are set.
 */
@ConfigurationProperties(prefix = "chartgate.admin")
public record AdminProperties(String username, String password) {

    public boolean configured() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "AdminProperties[username=" + username + ", password=[REDACTED]]";
    }
}
