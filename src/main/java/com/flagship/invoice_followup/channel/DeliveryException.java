package com.flagship.invoice_followup.channel;

/**
 * Base type for provider send failures.
 */
public abstract class DeliveryException extends RuntimeException {

    protected DeliveryException(String message) {
        super(message);
    }

    protected DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the same message may succeed if sent again later.
     */
    public abstract boolean isRetryable();
}
