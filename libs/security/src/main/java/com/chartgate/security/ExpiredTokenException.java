package com.chartgate.security;

import java.time.Instant;

/**
 * A correctly signed session token is past its expiry. The client should log in again.
 */
public class ExpiredTokenException extends GateRejectedException {

    private final Instant expiredAt;

    public ExpiredTokenException(Instant expiredAt) {
        super(RejectionReason.EXPIRED_TOKEN, "Session token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
