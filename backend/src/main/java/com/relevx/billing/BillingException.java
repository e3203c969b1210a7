package com.relevx.billing;

/**
 * Thrown when the billing provider cannot answer a subscription lookup (HTTP error, limiter timeout, bad payload).
 */
public class BillingException extends RuntimeException {

    public BillingException(String message) {
        super(message);
    }

    public BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
