package com.chartgate.gateway.chart;

import com.chartgate.security.TenantContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process store of created charts. Entries expire a fixed time after creation.
 */
public class ChartStore {

    private static final Logger log = LoggerFactory.getLogger(ChartStore.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final Clock clock;
    private final Cache<String, ChartRecord> charts;

    public ChartStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.charts = Caffeine.newBuilder().expireAfterWrite(ttl).build();
    }

    /**
     * Validates the request and stores a new chart owned by the caller.
     *
     * @throws IllegalArgumentException if the request is invalid
     */
    public ChartRecord create(ChartRequest request, TenantContext owner) {
        request.validate();
        ChartRecord chart = new ChartRecord(
                UUID.randomUUID().toString().replace("-", ""),
                request.chartType(),
                request.title(),
                request.data(),
                owner.tenantId(),
                clock.instant());
        charts.put(chart.chartId(), chart);
        log.debug("Stored chart {} ({})", chart.chartId(), chart.chartType());
        return chart;
    }

    public Optional<ChartRecord> find(String chartId) {
        return Optional.ofNullable(charts.getIfPresent(chartId));
    }

    /**
     * @throws ChartNotFoundException if no live chart has the id
     */
    public ChartRecord get(String chartId) {
        return find(chartId).orElseThrow(() -> new ChartNotFoundException(chartId));
    }
}
