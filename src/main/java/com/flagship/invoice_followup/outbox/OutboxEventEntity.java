package com.flagship.invoice_followup.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Row in outbox_events: one follow-up or credential lifecycle event waiting to reach Kafka.
 *
 * Rows are written in the same transaction as the ledger or vault change they describe and
 * are only ever mutated by the publisher's bookkeeping below. Once {@code retryCount}
 * reaches the publisher's max-retries the row is a dead letter: it stays in the table for
 * inspection but is no longer polled.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    /** Broker errors can carry whole stack traces; keep what an operator needs. */
    static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // assigned by the bigserial column, gives per-aggregate publish order
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    private OutboxEventEntity(OutboxEvent event) {
        this.id = event.getId();
        this.aggregateType = event.getAggregateType();
        this.aggregateId = event.getAggregateId();
        this.eventType = event.getEventType();
        this.payload = event.getPayload();
        this.createdAt = event.getCreatedAt();
        this.publishedAt = event.getPublishedAt();
        this.retryCount = event.getRetryCount();
        this.lastError = event.getLastError();
    }

    public static OutboxEventEntity fromDomain(OutboxEvent event) {
        return new OutboxEventEntity(event);
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
            createdAt, publishedAt, retryCount, lastError, sequenceNumber);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }

    public void markPublished(Instant at) {
        this.publishedAt = at;
        this.lastError = null;
    }

    /**
     * Counts one failed publish attempt.
     *
     * @return true if this attempt used up the last retry and the event is now a dead letter
     */
    public boolean recordPublishFailure(String errorMessage, int maxRetries) {
        boolean wasDeadLetter = isDeadLetter(maxRetries);
        this.retryCount++;
        this.lastError = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
            ? errorMessage.substring(0, MAX_ERROR_LENGTH)
            : errorMessage;
        return !wasDeadLetter && isDeadLetter(maxRetries);
    }
}
