package com.chartgate.gateway.api;

/**
 * Admin endpoints were called but no operator credentials are configured.
 */
public class AdminUnavailableException extends RuntimeException {

    public AdminUnavailableException() {
        super("Admin auth not configured.");
    }
}
