package com.flagship.invoice_followup.invoice;

import java.util.EnumSet;
import java.util.Set;

/**
 * Invoice status as reported by the accounting-system importer.
 */
public enum InvoiceStatus {
    OUTSTANDING,
    PAID,
    OVERDUE,
    PARTIALLY_PAID;

    /**
     * Statuses that still have money to collect and may receive reminders.
     */
    public static final Set<InvoiceStatus> COLLECTIBLE = EnumSet.of(OUTSTANDING, OVERDUE, PARTIALLY_PAID);

    public boolean isCollectible() {
        return COLLECTIBLE.contains(this);
    }
}
