package com.flagship.invoice_followup.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider callback relayed onto Kafka by the webhook bridge.
 *
 * {@code status} is the provider's own vocabulary, upper-cased: DELIVERED, BOUNCED,
 * OPENED and so on. Only DELIVERED moves the ledger.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryReceipt {

    public static final String EVENT_TYPE = "DeliveryReceipt";
    public static final String STATUS_DELIVERED = "DELIVERED";

    UUID receiptId;
    String providerMessageId;
    UUID followUpId;
    String status;
    Instant occurredAt;

    public boolean isDelivered() {
        return STATUS_DELIVERED.equalsIgnoreCase(status);
    }
}
