package com.adobe.aep.waflookout;

/**
 * The anomaly notification cannot be turned into a finding. Retrying the same input never helps.
 */
public class MalformedNotificationException extends LookoutException {

    public MalformedNotificationException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
