package com.adobe.aep.waflookout;

/**
 * The findings repository rejected a payload we considered well formed. Needs an operator.
 */
public class NonRetryableSubmissionException extends SubmissionException {

    public NonRetryableSubmissionException(String message) {
        super(message, false);
    }

    public NonRetryableSubmissionException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
