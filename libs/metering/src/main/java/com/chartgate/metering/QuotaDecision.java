package com.chartgate.metering;

/**
 * Outcome of {@link QuotaTracker#reserve}.
 *
 * @param admitted    whether a slot was reserved
 * @param reservation the reservation to commit or release, null when not admitted
 * @param remaining   slots left after this one, null when the quota is unbounded
 */
public record QuotaDecision(boolean admitted, QuotaReservation reservation, Long remaining) {

    static QuotaDecision admitted(QuotaReservation reservation, Long remaining) {
        return new QuotaDecision(true, reservation, remaining);
    }

    static QuotaDecision exceeded() {
        return new QuotaDecision(false, null, 0L);
    }
}
