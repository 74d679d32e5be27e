package com.flagship.invoice_followup.followup;

/**
 * Ledger row status.
 *
 * PENDING means claimed and in flight. SENT and DELIVERED are terminal successes and
 * block any further attempt for the same (invoice, template) pair. ARCHIVED is a FAILED row
 * moved out of the active set by the daily cleanup; it is never attempted again.
 */
public enum FollowUpStatus {
    PENDING,
    SENT,
    DELIVERED,
    FAILED,
    ARCHIVED;

    public boolean isDelivered() {
        return this == SENT || this == DELIVERED;
    }
}
