package com.adobe.aep.waflookout.records;

public record Severity(double product, int normalized, String label) {

    public static final int MIN_NORMALIZED = 0;
    public static final int MAX_NORMALIZED = 100;

    public Severity {
        if (normalized < MIN_NORMALIZED || normalized > MAX_NORMALIZED) {
            throw new IllegalArgumentException("Normalized severity must be within [0,100]: " + normalized);
        }
        if (!Double.isFinite(product) || product < 0) {
            throw new IllegalArgumentException("Product severity must be a finite non-negative number: " + product);
        }
    }

    public Severity(double product, int normalized) {
        this(product, normalized, labelFor(normalized));
    }

    /**
     * Security Hub's mapping from a normalized score to a severity label.
     */
    public static String labelFor(int normalized) {
        if (normalized == 0) {
            return "INFORMATIONAL";
        } else if (normalized < 40) {
            return "LOW";
        } else if (normalized < 70) {
            return "MEDIUM";
        } else if (normalized < 90) {
            return "HIGH";
        }
        return "CRITICAL";
    }
}
