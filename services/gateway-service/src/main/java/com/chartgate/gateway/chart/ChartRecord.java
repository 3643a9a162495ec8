package com.chartgate.gateway.chart;

import java.time.Instant;

/**
 * A created chart.
 *
 * @param chartId       opaque id used in embed URLs
 * @param chartType     requested type, "auto" when the caller left it to detection
 * @param title         optional title
 * @param data          submitted data, as received
 * @param ownerTenantId tenant that created it, null for tenant-less callers
 * @param createdAt     creation time
 */
public record ChartRecord(
        String chartId,
        String chartType,
        String title,
        String data,
        String ownerTenantId,
        Instant createdAt) {}
