package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.invoice.Invoice;
import com.flagship.invoice_followup.template.MessageTemplate;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An (invoice, template) pair whose send window is open, as seen by one scan.
 *
 * {@code observedAttempt} is the ledger's attempt count at scan time (0 when there was no
 * row). The claim only succeeds if the row still carries that value.
 */
@Value
@Builder
public class FollowUpCandidate {
    Invoice invoice;
    MessageTemplate template;
    String companyName;
    Instant scheduledAt;
    UUID existingFollowUpId;
    int observedAttempt;

    public boolean isFirstAttempt() {
        return existingFollowUpId == null;
    }

    public static FollowUpCandidate first(Invoice invoice, MessageTemplate template,
                                          String companyName, Instant scheduledAt) {
        return FollowUpCandidate.builder()
            .invoice(invoice)
            .template(template)
            .companyName(companyName)
            .scheduledAt(scheduledAt)
            .observedAttempt(0)
            .build();
    }

    public static FollowUpCandidate retry(Invoice invoice, MessageTemplate template,
                                          String companyName, FollowUp existing) {
        return FollowUpCandidate.builder()
            .invoice(invoice)
            .template(template)
            .companyName(companyName)
            .scheduledAt(existing.getScheduledAt())
            .existingFollowUpId(existing.getId())
            .observedAttempt(existing.getAttemptCount())
            .build();
    }
}
