package com.chartgate.gateway.chart;

import jakarta.validation.constraints.Size;
import java.util.Locale;
import java.util.Set;

/**
 * Chart creation input.
 *
 * @param data      CSV or JSON data, required
 * @param chartType one of {@link #CHART_TYPES}, "auto" when omitted
 * @param title     optional title
 */
public record ChartRequest(String data, String chartType, @Size(max = 200) String title) {

    public static final String AUTO = "auto";

    public static final Set<String> CHART_TYPES =
            Set.of(AUTO, "bar", "line", "area", "pie", "scatter", "histogram");

    public ChartRequest {
        chartType = chartType == null || chartType.isBlank()
                ? AUTO
                : chartType.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if data is missing or the chart type is unknown
     */
    public void validate() {
        if (data == null || data.isBlank()) {
            throw new IllegalArgumentException("Provide chart data in the 'data' field.");
        }
        if (!CHART_TYPES.contains(chartType)) {
            throw new IllegalArgumentException("Unknown chart type: " + chartType);
        }
    }
}
