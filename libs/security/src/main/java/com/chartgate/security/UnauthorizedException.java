package com.chartgate.security;

/**
 * No credential was presented, or it matched nothing while static keys are configured.
 */
public class UnauthorizedException extends GateRejectedException {

    public UnauthorizedException(String message) {
        super(RejectionReason.UNAUTHORIZED, message);
    }
}
