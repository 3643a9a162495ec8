package com.chartgate.security;

/**
 * Base type for every typed rejection produced while authenticating or metering a request.
 * <p>
 * Unchecked: rejections travel straight up to the HTTP layer, which maps {@link #reason()} to a
 * response. Nothing between the gate and the exception handler recovers from them.
 */
public abstract class GateRejectedException extends RuntimeException {

    private final RejectionReason reason;

    protected GateRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected GateRejectedException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
