package com.flagship.invoice_followup.outbox;

import com.flagship.invoice_followup.event.CredentialRevokedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Publisher bookkeeping on a single outbox row.
 */
class OutboxEventEntityTest {

    private static final Instant NOW = Instant.parse("2025-01-09T09:00:00Z");

    private OutboxEventEntity newEntity() {
        OutboxEvent event = OutboxEvent.create(CredentialRevokedEvent.AGGREGATE_TYPE, UUID.randomUUID(),
            CredentialRevokedEvent.EVENT_TYPE, "{\"reason\":\"invalid_grant\"}", NOW);
        return OutboxEventEntity.fromDomain(event);
    }

    @Test
    @DisplayName("Only the failure that uses up the last retry reports a new dead letter")
    void testDeadLetterTransition() {
        OutboxEventEntity entity = newEntity();

        assertFalse(entity.recordPublishFailure("broker down", 3));
        assertFalse(entity.recordPublishFailure("broker down", 3));
        assertTrue(entity.recordPublishFailure("broker down", 3));
        assertTrue(entity.isDeadLetter(3));
        assertFalse(entity.recordPublishFailure("broker down", 3), "Already a dead letter");
        assertEquals(4, entity.getRetryCount());
    }

    @Test
    @DisplayName("Long broker errors are truncated; publishing clears the error")
    void testErrorTruncatedAndClearedOnPublish() {
        OutboxEventEntity entity = newEntity();

        entity.recordPublishFailure("x".repeat(OutboxEventEntity.MAX_ERROR_LENGTH + 500), 5);
        assertEquals(OutboxEventEntity.MAX_ERROR_LENGTH, entity.getLastError().length());

        entity.markPublished(NOW.plusSeconds(5));
        assertTrue(entity.isPublished());
        assertNull(entity.getLastError());
        assertFalse(entity.isDeadLetter(1), "Published rows are never dead letters");
        assertEquals(entity.getId(), entity.toDomain().getId());
    }
}
