package com.flagship.invoice_followup.followup;

/**
 * The invoice or template data cannot produce a deliverable message, e.g. the customer
 * has no address for the template's channel.
 */
public class FollowUpValidationException extends RuntimeException {

    public FollowUpValidationException(String message) {
        super(message);
    }
}
