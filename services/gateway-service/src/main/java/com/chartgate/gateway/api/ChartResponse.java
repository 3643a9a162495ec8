package com.chartgate.gateway.api;

import com.chartgate.gateway.chart.ChartRecord;
import java.time.Instant;

/**
 * Chart metadata returned to API callers. The submitted data is not echoed back.
 */
public record ChartResponse(
        String id, String chartType, String title, String embedUrl, Instant createdAt) {

    static ChartResponse from(ChartRecord chart) {
        return new ChartResponse(
                chart.chartId(),
                chart.chartType(),
                chart.title(),
                "/v1/charts/" + chart.chartId() + "/embed",
                chart.createdAt());
    }
}
