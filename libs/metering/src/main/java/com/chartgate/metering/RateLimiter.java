package com.chartgate.metering;

import com.chartgate.security.RateLimitSpec;
import com.chartgate.security.RateWindow;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory fixed-window rate limiter keyed by rate-limit identity.
 * <p>
 * Windows are aligned to multiples of their length on the injected clock, so a
 * {@code 60/minute} identity gets a fresh allowance at every full minute. Each identity has its own
 * entry and lock; calls for different identities never contend. Entries idle for longer than the
 * longest window are evicted, and the cache is capped at {@code maxIdentities}.
 * <p>
 * Counters are process-local and reset on restart.
 */
public final class RateLimiter {

    private static final Duration IDLE_EXPIRY = RateWindow.HOUR.length().plusMinutes(1);

    private final Clock clock;
    private final Cache<String, LimiterEntry> entries;

    public RateLimiter(Clock clock, long maxIdentities) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (maxIdentities <= 0) {
            throw new IllegalArgumentException("maxIdentities must be > 0");
        }
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxIdentities)
                .expireAfterAccess(IDLE_EXPIRY)
                .build();
    }

    /**
     * Counts one request against {@code identity}.
     *
     * @param identity rate-limit identity (see {@code TenantContext#rateLimitIdentity})
     * @param spec     the identity's current limit, or null for unrestricted
     * @return admit, or throttled with the seconds until the window resets
     */
    public RateDecision allow(String identity, RateLimitSpec spec) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (spec == null) {
            return RateDecision.admit();
        }
        LimiterEntry entry = entries.get(identity, k -> new LimiterEntry());
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.tryAcquire(spec, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /** Approximate number of tracked identities. */
    public long trackedIdentities() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    /**
     * Window state for one identity. Mutated only while holding {@link #lock()}.
     */
    static final class LimiterEntry {

        private final ReentrantLock lock = new ReentrantLock();
        private RateWindow window;
        private long windowStartMillis = -1;
        private long used;

        ReentrantLock lock() {
            return lock;
        }

        RateDecision tryAcquire(RateLimitSpec spec, long nowMillis) {
            long lengthMillis = spec.window().length().toMillis();
            long start = Math.floorDiv(nowMillis, lengthMillis) * lengthMillis;
            if (spec.window() != window || start != windowStartMillis) {
                window = spec.window();
                windowStartMillis = start;
                used = 0;
            }
            // a lowered limit takes effect at once: used may already exceed it
            if (used < spec.limit()) {
                used++;
                return RateDecision.admit();
            }
            long remainingMillis = windowStartMillis + lengthMillis - nowMillis;
            return RateDecision.throttled(Math.floorDiv(remainingMillis + 999, 1000));
        }
    }
}
