package com.adobe.aep.waflookout.records;

import java.time.Instant;
import java.util.Objects;

public record MetricDataPoint(
        MetricSeries series,
        double value,
        Instant timestamp,
        String unit
) {

    public static final String UNIT_COUNT = "Count";

    public MetricDataPoint {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException("Metric value must be a finite non-negative number: " + value);
        }
    }

    public static MetricDataPoint zero(MetricSeries series, Instant timestamp) {
        return new MetricDataPoint(series, 0d, timestamp, UNIT_COUNT);
    }
}
