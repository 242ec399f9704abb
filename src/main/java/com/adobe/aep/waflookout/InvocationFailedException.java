package com.adobe.aep.waflookout;

/**
 * Thrown out of a Lambda handler to fail the invocation so the platform retries it.
 */
public class InvocationFailedException extends RuntimeException {

    public InvocationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
