package com.adobe.aep.waflookout;

public class SubmissionException extends LookoutException {

    private final boolean retryable;

    public SubmissionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public SubmissionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
