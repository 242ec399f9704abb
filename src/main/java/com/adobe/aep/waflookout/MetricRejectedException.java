package com.adobe.aep.waflookout;

/**
 * The metric store refused the data point, for example a reserved namespace or missing permission.
 * Repeating the same write cannot succeed until the configuration changes.
 */
public class MetricRejectedException extends LookoutException {

    public MetricRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
