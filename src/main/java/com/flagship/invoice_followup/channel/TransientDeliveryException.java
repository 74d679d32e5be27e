package com.flagship.invoice_followup.channel;

/**
 * Timeouts, 5xx responses, rate limiting. The send may be retried after backoff.
 */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
