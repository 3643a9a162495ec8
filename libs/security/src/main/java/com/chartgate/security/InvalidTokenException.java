package com.chartgate.security;

/**
 * A session token was malformed, unsigned, signed with another secret, or missing claims.
 */
public class InvalidTokenException extends GateRejectedException {

    public InvalidTokenException(String message) {
        super(RejectionReason.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(RejectionReason.INVALID_TOKEN, message, cause);
    }
}
