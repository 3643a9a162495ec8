package com.chartgate.gateway.api;

/**
 * A tenant, key or account addressed by the request does not exist (or is not the caller's).
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
