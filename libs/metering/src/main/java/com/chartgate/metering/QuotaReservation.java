package com.chartgate.metering;

import java.time.Instant;

/**
 * An admitted request's hold on one unit of quota, kept until it is committed or released.
 * <p>
 * Leased reservations are persisted and count against the quota until {@code expiresAt}.
 * Reservations under an unbounded quota are not persisted ({@code leased == false}) and only
 * carry the tenant and period the eventual commit is counted in.
 * <p>
 * A leased reservation also carries its quota, so a commit whose lease was purged can check that
 * the slot is still free before counting.
 *
 * @param reservationId unique id
 * @param tenantId      tenant charged on commit
 * @param period        period charged on commit, fixed at admission
 * @param createdAt     admission time
 * @param expiresAt     lease expiry, null when not leased
 * @param leased        whether a lease row exists in the usage store
 * @param quota         quota in force at admission, null when unbounded
 */
public record QuotaReservation(
        String reservationId,
        String tenantId,
        BillingPeriod period,
        Instant createdAt,
        Instant expiresAt,
        boolean leased,
        Long quota
) {

    public boolean isExpired(Instant now) {
        return leased && !now.isBefore(expiresAt);
    }
}
