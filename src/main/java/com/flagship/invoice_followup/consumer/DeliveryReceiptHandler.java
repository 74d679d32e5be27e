package com.flagship.invoice_followup.consumer;

import com.flagship.invoice_followup.followup.FollowUpLedger;
import com.flagship.invoice_followup.observability.FollowUpMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies delivery receipts to the ledger. Called only after the idempotency check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryReceiptHandler {

    private final FollowUpLedger ledger;
    private final FollowUpMetrics metrics;
    private final Clock clock;

    /**
     * Moves the matching SENT row to DELIVERED. A receipt for a row that is already
     * DELIVERED, or that never reached SENT, changes nothing.
     */
    public void onDelivered(DeliveryReceipt receipt) {
        Instant at = receipt.getOccurredAt() != null ? receipt.getOccurredAt() : clock.instant();
        boolean changed = ledger.markDelivered(receipt.getProviderMessageId(), at);
        metrics.recordReceiptProcessed(receipt.getStatus(), changed);

        if (changed) {
            log.info("Follow-up delivered: providerMessageId={}, deliveredAt={}",
                receipt.getProviderMessageId(), at);
        } else {
            log.info("Delivery receipt matched no SENT follow-up: providerMessageId={}",
                receipt.getProviderMessageId());
        }
    }
}
