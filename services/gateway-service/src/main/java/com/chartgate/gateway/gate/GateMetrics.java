package com.chartgate.gateway.gate;

import com.chartgate.observability.MetricFactory;
import com.chartgate.security.AuthSource;
import com.chartgate.security.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Meters for the gate. Tags come from closed enums only.
 */
public final class GateMetrics {

    static final String ADMISSIONS = "gate.admissions";
    static final String REJECTIONS = "gate.rejections";
    static final String USAGE_RECORDED = "gate.usage.recorded";
    static final String USAGE_RELEASED = "gate.usage.released";
    static final String USAGE_LOST = "gate.usage.lost";
    static final String HANDLER_DURATION = "gate.handler.duration";

    private final Map<AuthSource, Counter> admissions = new EnumMap<>(AuthSource.class);
    private final Map<RejectionReason, Counter> rejections = new EnumMap<>(RejectionReason.class);
    private final Counter usageRecorded;
    private final Counter usageReleased;
    private final Counter usageLost;
    private final Timer handlerDuration;

    public GateMetrics(MetricFactory metrics) {
        for (AuthSource source : AuthSource.values()) {
            admissions.put(source, metrics.counter(
                    ADMISSIONS, "Requests admitted by the gate", "auth_source", source.value()));
        }
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, metrics.counter(
                    REJECTIONS, "Requests turned away by the gate", "reason", reason.slug()));
        }
        this.usageRecorded = metrics.counter(USAGE_RECORDED, "Completed requests recorded as usage");
        this.usageReleased = metrics.counter(USAGE_RELEASED, "Admitted requests released uncharged");
        this.usageLost = metrics.counter(USAGE_LOST, "Completed requests left uncharged after a lost lease");
        this.handlerDuration = metrics.timer(HANDLER_DURATION, "Time spent in gated handlers");
    }

    void admitted(AuthSource source) {
        admissions.get(source).increment();
    }

    void rejected(RejectionReason reason) {
        rejections.get(reason).increment();
    }

    void usageRecorded() {
        usageRecorded.increment();
    }

    void usageReleased() {
        usageReleased.increment();
    }

    void usageLost() {
        usageLost.increment();
    }

    <T> T timeHandler(Callable<T> handler) throws Exception {
        return handlerDuration.recordCallable(handler);
    }
}
