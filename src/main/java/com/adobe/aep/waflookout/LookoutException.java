package com.adobe.aep.waflookout;

/**
 * Base of every failure the publisher and the finding builder report to their caller.
 */
public abstract class LookoutException extends Exception {

    protected LookoutException(String message) {
        super(message);
    }

    protected LookoutException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call unchanged can succeed.
     */
    public abstract boolean isRetryable();
}
