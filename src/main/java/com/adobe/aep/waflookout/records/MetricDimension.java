package com.adobe.aep.waflookout.records;

import java.util.Objects;

public record MetricDimension(String name, String value) {

    public MetricDimension {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Dimension name must not be blank");
        }
    }
}
