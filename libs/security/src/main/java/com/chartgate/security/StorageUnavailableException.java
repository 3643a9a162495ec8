package com.chartgate.security;

/**
 * A durable store (accounts or usage) could not be reached or failed mid-operation.
 * <p>
 * The only server-side failure in the taxonomy. It is never converted into an authentication
 * outcome: a storage outage rejects the request, it does not fall through to the static key
 * list or to dev mode.
 */
public class StorageUnavailableException extends GateRejectedException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(RejectionReason.STORAGE_UNAVAILABLE, message, cause);
    }
}
