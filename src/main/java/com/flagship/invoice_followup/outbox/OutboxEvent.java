package com.flagship.invoice_followup.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same transaction as the ledger or vault change it describes, so an
 * event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "FollowUp" or "Credential"
    UUID aggregateId;          // follow-up id or credential owner id
    String eventType;          // e.g. "FollowUpSent"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once the publisher has given up on this event.
     */
    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
