package com.flagship.invoice_followup.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events published through the outbox.
 */
public interface LifecycleEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Follow-up id or credential owner id. Also the Kafka record key.
     */
    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();

    String getAggregateType();
}
