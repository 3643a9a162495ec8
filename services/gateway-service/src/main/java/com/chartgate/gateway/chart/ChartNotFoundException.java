package com.chartgate.gateway.chart;

/**
 * No live chart under the requested id.
 */
public class ChartNotFoundException extends RuntimeException {

    public ChartNotFoundException(String chartId) {
        super("Chart not found: " + chartId);
    }
}
