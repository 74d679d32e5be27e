package com.flagship.invoice_followup.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_followup.followup.FollowUp;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A dispatch attempt failed. {@code retryable} tells consumers whether the engine will
 * try again on its own.
 */
@Value
public class FollowUpFailedEvent implements LifecycleEvent {
    UUID eventId;
    UUID followUpId;
    UUID invoiceId;
    UUID templateId;
    String channel;
    int attempt;
    String failureKind;
    String errorMessage;
    boolean retryable;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FollowUpFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return FollowUpSentEvent.AGGREGATE_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return followUpId;
    }

    public static FollowUpFailedEvent from(FollowUp failed, boolean retryable) {
        return new FollowUpFailedEvent(
            UUID.randomUUID(),
            failed.getId(),
            failed.getInvoiceId(),
            failed.getTemplateId(),
            failed.getChannel().name(),
            failed.getAttemptCount(),
            failed.getFailureKind().name(),
            failed.getErrorMessage(),
            retryable,
            failed.getFailedAt()
        );
    }
}
