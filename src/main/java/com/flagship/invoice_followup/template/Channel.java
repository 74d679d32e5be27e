package com.flagship.invoice_followup.template;

/**
 * Delivery channel of a reminder.
 */
public enum Channel {
    EMAIL,
    SMS
}
