package com.adobe.aep.waflookout.records;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of one metric time series: namespace, metric name and the ordered dimension set.
 */
public record MetricSeries(String namespace, String metricName, List<MetricDimension> dimensions) {

    public MetricSeries {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(metricName, "metricName");
        dimensions = List.copyOf(dimensions);
        Set<String> names = new HashSet<>();
        for (MetricDimension dimension : dimensions) {
            if (!names.add(dimension.name())) {
                throw new IllegalArgumentException("Duplicate dimension name: " + dimension.name());
            }
        }
    }
}
