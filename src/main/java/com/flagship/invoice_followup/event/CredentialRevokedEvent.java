package com.flagship.invoice_followup.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An owner's accounting-system connection is dead and must be re-linked by the user.
 */
@Value
public class CredentialRevokedEvent implements LifecycleEvent {
    UUID eventId;
    UUID ownerId;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CredentialRevoked";
    public static final String AGGREGATE_TYPE = "Credential";

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
        return ownerId;
    }

    public static CredentialRevokedEvent of(UUID ownerId, String reason, Instant at) {
        return new CredentialRevokedEvent(UUID.randomUUID(), ownerId, reason, at);
    }
}
