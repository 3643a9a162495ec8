package com.chartgate.gateway.gate;

import com.chartgate.metering.QuotaReservation;
import com.chartgate.metering.QuotaTracker;
import com.chartgate.security.TenantContext;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An admitted request, holding its quota reservation until the handler outcome is known.
 *
 * <p>Exactly one of {@link #complete()} and {@link #abandon()} takes effect; whichever runs first
 * wins and every later call is a no-op. Tenant-less callers hold an unleased reservation on their
 * key's usage counter, so abandoning them touches no store.
 */
public final class Admission {

    private static final Logger log = LoggerFactory.getLogger(Admission.class);

    private final TenantContext context;
    private final QuotaReservation reservation;
    private final Long remainingQuota;
    private final QuotaTracker quota;
    private final GateMetrics metrics;
    private final AtomicBoolean settled = new AtomicBoolean();

    Admission(
            TenantContext context,
            QuotaReservation reservation,
            Long remainingQuota,
            QuotaTracker quota,
            GateMetrics metrics) {
        this.context = context;
        this.reservation = reservation;
        this.remainingQuota = remainingQuota;
        this.quota = quota;
        this.metrics = metrics;
    }

    public TenantContext context() {
        return context;
    }

    /** The reservation this admission settles. */
    public QuotaReservation reservation() {
        return reservation;
    }

    /** Quota left after this request, empty when the caller has no bounded quota. */
    public Optional<Long> remainingQuota() {
        return Optional.ofNullable(remainingQuota);
    }

    /**
     * Charges the request to the tenant's usage. A request whose lease lapsed and whose slot was
     * since taken is settled without a charge.
     *
     * @return true if this call settled the admission
     */
    public boolean complete() {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        if (quota.commit(reservation)) {
            metrics.usageRecorded();
            log.debug("Recorded usage for {} in {}",
                    reservation.tenantId(), reservation.period().id());
        } else {
            metrics.usageLost();
        }
        return true;
    }

    /**
     * Releases the reservation without charging.
     *
     * @return true if this call settled the admission
     */
    public boolean abandon() {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        quota.release(reservation);
        metrics.usageReleased();
        log.debug("Released reservation {} for {}",
                reservation.reservationId(), reservation.tenantId());
        return true;
    }

    public boolean isSettled() {
        return settled.get();
    }
}
