package com.adobe.aep.waflookout;

/**
 * The metric store could not be reached. The next scheduled tick, or a retry of this one, is safe.
 */
public class TransientPublishException extends LookoutException {

    public TransientPublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
