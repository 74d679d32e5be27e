package com.flagship.invoice_followup.channel;

/**
 * Rejected recipient, blocked sender, malformed request. Never retried automatically.
 */
public class PermanentDeliveryException extends DeliveryException {

    public PermanentDeliveryException(String message) {
        super(message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
