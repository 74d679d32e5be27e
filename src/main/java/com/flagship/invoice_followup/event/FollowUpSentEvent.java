package com.flagship.invoice_followup.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_followup.followup.FollowUp;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A reminder was accepted by the channel provider.
 */
@Value
public class FollowUpSentEvent implements LifecycleEvent {
    UUID eventId;
    UUID followUpId;
    UUID invoiceId;
    UUID templateId;
    String channel;
    int attempt;
    String providerMessageId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FollowUpSent";
    public static final String AGGREGATE_TYPE = "FollowUp";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return followUpId;
    }

    public static FollowUpSentEvent from(FollowUp sent) {
        return new FollowUpSentEvent(
            UUID.randomUUID(),
            sent.getId(),
            sent.getInvoiceId(),
            sent.getTemplateId(),
            sent.getChannel().name(),
            sent.getAttemptCount(),
            sent.getProviderMessageId(),
            sent.getSentAt()
        );
    }
}
