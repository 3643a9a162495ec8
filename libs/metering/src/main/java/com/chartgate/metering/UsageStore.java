package com.chartgate.metering;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-(tenant, period) usage counters and the reservations held against them.
 * <p>
 * {@link #reserve} must be atomic per counter: two concurrent calls for the same tenant and period
 * never both see the same free slot. Storage failures surface as
 * {@code StorageUnavailableException}.
 */
public interface UsageStore {

    /**
     * Stores {@code reservation} if {@code committed + liveReservations < quota}, creating the
     * period's record at zero on first use. Reservations expired at {@code now} do not count and
     * may be deleted.
     */
    ReservationOutcome reserve(QuotaReservation reservation, long quota, Instant now);

    /**
     * Adds one to the reservation's period count and drops its lease if one is stored. Called at
     * most once per reservation.
     * <p>
     * A leased reservation whose lease is no longer stored is counted only if
     * {@code committed + liveReservations < quota} still holds at {@code now}, under the same
     * per-counter atomicity as {@link #reserve}.
     *
     * @return whether the request was counted
     */
    boolean commit(QuotaReservation reservation, Instant now);

    /** Drops the reservation's lease without touching the count. */
    void release(QuotaReservation reservation);

    Optional<UsageRecord> find(String tenantId, BillingPeriod period);

    /** Records of a tenant, most recent period first, at most {@code limit}. */
    List<UsageRecord> history(String tenantId, int limit);
}
