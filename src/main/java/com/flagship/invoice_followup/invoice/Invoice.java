package com.flagship.invoice_followup.invoice;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invoice domain object, as seen by the follow-up engine.
 *
 * Rows are owned by the importer; the engine only reads them and stamps
 * {@code lastFollowUpAt} after a successful send.
 */
@Value
@Builder(toBuilder = true)
public class Invoice {
    UUID id;
    UUID companyId;
    String externalInvoiceId;
    String customerName;
    String customerEmail;
    String customerPhone;
    BigDecimal amount;
    String currency;
    LocalDate dueDate;
    InvoiceStatus status;
    boolean excluded;
    Instant lastFollowUpAt;

    /**
     * True when the invoice may receive reminders at all: not opted out and still unpaid.
     */
    public boolean acceptsFollowUps() {
        return !excluded && status != null && status.isCollectible();
    }
}
