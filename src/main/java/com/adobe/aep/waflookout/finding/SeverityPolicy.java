package com.adobe.aep.waflookout.finding;

import com.adobe.aep.waflookout.records.Severity;

import java.util.Locale;

/**
 * Maps an anomaly score to a finding severity.
 */
@FunctionalInterface
public interface SeverityPolicy {

    double DEFAULT_PRODUCT = 1;
    int DEFAULT_NORMALIZED = 10;

    Severity severityFor(double anomalyScore);

    /**
     * Ignores the score.
     */
    static SeverityPolicy fixed(double product, int normalized) {
        Severity severity = new Severity(product, normalized);
        return anomalyScore -> severity;
    }

    static SeverityPolicy fixed() {
        return fixed(DEFAULT_PRODUCT, DEFAULT_NORMALIZED);
    }

    /**
     * Lookout for Metrics scores run from 0 to 100; the product score is the raw score, the normalized
     * score its rounded value clamped to [0,100].
     */
    static SeverityPolicy proportional() {
        return anomalyScore -> {
            double product = Math.max(0d, anomalyScore);
            int normalized = (int) Math.round(Math.min(Severity.MAX_NORMALIZED, product));
            return new Severity(product, normalized);
        };
    }

    static SeverityPolicy named(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "fixed":
                return fixed();
            case "proportional":
                return proportional();
            default:
                throw new IllegalStateException("Unknown severity policy: " + name);
        }
    }
}
