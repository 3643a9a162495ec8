package com.chartgate.metering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Monthly quota accounting per tenant.
 * <p>
 * Admission reserves a slot; the count only grows when the reservation is committed. A released
 * or abandoned reservation leaves the count untouched, and a lease that is never settled stops
 * holding quota once it expires.
 */
public final class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    /** Periods returned by {@link #history(String)}. */
    public static final int DEFAULT_HISTORY = 12;

    private final UsageStore store;
    private final Clock clock;
    private final Duration lease;

    public QuotaTracker(UsageStore store, Clock clock, Duration lease) {
        if (lease == null || lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        this.store = store;
        this.clock = clock;
        this.lease = lease;
    }

    /**
     * Reserves one request in the current period.
     *
     * @param monthlyQuota the tenant's quota, null for unbounded
     */
    public QuotaDecision reserve(String tenantId, Long monthlyQuota) {
        Instant now = clock.instant();
        BillingPeriod period = BillingPeriod.of(now);
        String id = UUID.randomUUID().toString();
        if (monthlyQuota == null) {
            return QuotaDecision.admitted(
                    new QuotaReservation(id, tenantId, period, now, null, false, null), null);
        }
        QuotaReservation candidate =
                new QuotaReservation(
                id, tenantId, period, now, now.plus(lease), true, monthlyQuota);
        ReservationOutcome outcome = store.reserve(candidate, monthlyQuota, now);
        if (!outcome.granted()) {
            log.info("Quota exhausted for tenant {} in {} ({} used, {} in flight, quota {})",
                    tenantId, period.id(), outcome.committed(), outcome.inFlight(), monthlyQuota);
            return QuotaDecision.exceeded();
        }
        long remaining = Math.max(0, monthlyQuota - outcome.committed() - outcome.inFlight());
        return QuotaDecision.admitted(candidate, remaining);
    }

    /**
     * Counts the reserved request as completed.
     *
     * @return false if the lease had lapsed and its slot was taken by another request, in which
     *     case nothing is counted
     */
    public boolean commit(QuotaReservation reservation) {
        boolean counted = store.commit(reservation, clock.instant());
        if (!counted) {
            log.warn("Lost lease {} for tenant {} in {}: quota {} already in use, not counted",
                    reservation.reservationId(), reservation.tenantId(),
                    reservation.period().id(), reservation.quota());
        }
        return counted;
    }

    /** Frees the reserved slot without counting it. */
    public void release(QuotaReservation reservation) {
        if (reservation.leased()) {
            store.release(reservation);
        }
    }

    /** The tenant's record for the current period, zero if nothing was counted yet. */
    public UsageRecord currentUsage(String tenantId) {
        BillingPeriod period = BillingPeriod.of(clock.instant());
        return store.find(tenantId, period).orElseGet(() -> UsageRecord.empty(tenantId, period));
    }

    public List<UsageRecord> history(String tenantId) {
        return history(tenantId, DEFAULT_HISTORY);
    }

    public List<UsageRecord> history(String tenantId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return store.history(tenantId, limit);
    }

    public Duration lease() {
        return lease;
    }
}
