package com.chartgate.gateway.gate;

import com.chartgate.metering.BillingPeriod;
import com.chartgate.metering.QuotaDecision;
import com.chartgate.metering.QuotaExceededException;
import com.chartgate.metering.QuotaTracker;
import com.chartgate.metering.RateDecision;
import com.chartgate.metering.RateLimiter;
import com.chartgate.metering.ThrottledException;
import com.chartgate.observability.CorrelationContextHolder;
import com.chartgate.observability.CredentialRedactor;
import com.chartgate.security.AuthResolver;
import com.chartgate.security.GateRejectedException;
import com.chartgate.security.RejectionReason;
import com.chartgate.security.StorageUnavailableException;
import com.chartgate.security.TenantContext;
import java.time.Clock;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission pipeline in front of every chart request.
 *
 * <p>Stages run in a fixed order and the first rejection ends the request:
 *
 * <ol>
 *   <li>resolve the API key into a {@link TenantContext}
 *   <li>count the request against the caller's rate window
 *   <li>reserve one unit of the tenant's monthly quota (tenant callers only)
 * </ol>
 *
 * <p>Tenant-less callers have no quota, but their completed requests are still counted per key
 * so they can read their own usage.
 *
 * <p>Usage is charged only after the handler's side effect is confirmed. A throttled request
 * never reaches the quota stage, so it consumes no quota; a quota rejection does consume a slot
 * in the rate window.
 */
public final class Gate {

    private static final Logger log = LoggerFactory.getLogger(Gate.class);

    private final AuthResolver resolver;
    private final RateLimiter rateLimiter;
    private final QuotaTracker quota;
    private final GateMetrics metrics;
    private final Clock clock;
    private final CredentialRedactor redactor = new CredentialRedactor();

    public Gate(
            AuthResolver resolver,
            RateLimiter rateLimiter,
            QuotaTracker quota,
            GateMetrics metrics,
            Clock clock) {
        this.resolver = resolver;
        this.rateLimiter = rateLimiter;
        this.quota = quota;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs all three stages. The caller must settle the returned admission.
     *
     * @param credential the {@code X-API-Key} value, null when absent
     * @throws GateRejectedException when any stage turns the request away
     */
    public Admission admit(String credential) {
        TenantContext context = resolve(credential);
        checkRate(context, credential);
        if (!context.isMetered()) {
            metrics.admitted(context.authSource());
            QuotaDecision unbounded = quota.reserve(context.usageKey(), null);
            return new Admission(context, unbounded.reservation(), null, quota, metrics);
        }
        QuotaDecision decision;
        try {
            decision = quota.reserve(context.tenantId(), context.plan().monthlyQuota());
        } catch (GateRejectedException e) {
            throw rejected(e, credential);
        }
        if (!decision.admitted()) {
            throw rejected(
                    new QuotaExceededException(
                            context.tenantId(),
                            context.plan().monthlyQuota(),
                            BillingPeriod.of(clock.instant())),
                    credential);
        }
        metrics.admitted(context.authSource());
        log.debug("Admitted tenant {} on plan {}", context.tenantId(), context.plan().planId());
        return new Admission(context, decision.reservation(), decision.remaining(), quota, metrics);
    }

    /**
     * Admits, runs the handler and settles the admission.
     *
     * <p>Usage is recorded only when the handler returns normally and the calling thread has not
     * been interrupted. A handler failure or an interrupt releases the reservation and the
     * failure propagates unchanged.
     *
     * @throws CancellationException if the thread was interrupted while the handler ran
     */
    public <T> T execute(String credential, GatedCall<T> call) throws Exception {
        Admission admission = admit(credential);
        T result;
        try {
            result = metrics.timeHandler(() -> call.call(admission.context()));
        } catch (Throwable failure) {
            abandonAfter(admission, failure);
            throw failure;
        }
        if (Thread.currentThread().isInterrupted()) {
            CancellationException cancelled =
                    new CancellationException("Request cancelled before usage was recorded");
            abandonAfter(admission, cancelled);
            throw cancelled;
        }
        try {
            admission.complete();
        } catch (GateRejectedException e) {
            throw rejected(e, credential);
        }
        return result;
    }

    /**
     * Resolves and rate-checks a read that is not charged against quota.
     */
    public TenantContext authorizeRead(String credential) {
        TenantContext context = resolve(credential);
        checkRate(context, credential);
        metrics.admitted(context.authSource());
        return context;
    }

    /**
     * Resolves the caller without counting the request anywhere.
     */
    public TenantContext identify(String credential) {
        return resolve(credential);
    }

    private TenantContext resolve(String credential) {
        try {
            TenantContext context = resolver.resolve(credential);
            CorrelationContextHolder.enrichCaller(context.tenantId(), context.authSource().value());
            return context;
        } catch (GateRejectedException e) {
            throw rejected(e, credential);
        }
    }

    private void checkRate(TenantContext context, String credential) {
        RateDecision decision =
                rateLimiter.allow(context.rateLimitIdentity(), context.plan().rateLimit());
        if (!decision.admitted()) {
            throw rejected(new ThrottledException(decision), credential);
        }
    }

    private void abandonAfter(Admission admission, Throwable failure) {
        try {
            admission.abandon();
        } catch (StorageUnavailableException e) {
            log.error("Could not release reservation after handler failure", e);
            failure.addSuppressed(e);
        }
    }

    private GateRejectedException rejected(GateRejectedException e, String credential) {
        metrics.rejected(e.reason());
        if (e.reason() == RejectionReason.STORAGE_UNAVAILABLE) {
            log.error("Gate storage failure for key {}", redactor.mask(credential), e);
        } else {
            log.info("Rejected request for key {} ({}): {}",
                    redactor.mask(credential), e.reason().slug(), e.getMessage());
        }
        return e;
    }
}
