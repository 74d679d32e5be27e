package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.template.Channel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-side JPA mapping of the follow_ups table.
 *
 * All writes go through {@link JdbcFollowUpLedger} as single conditional statements,
 * so the entity is immutable to Hibernate.
 */
@Entity
@Immutable
@Table(
    name = "follow_ups",
    uniqueConstraints = @UniqueConstraint(name = "uq_follow_ups_invoice_template",
        columnNames = {"invoice_id", "template_id"}),
    indexes = {
        @Index(name = "idx_follow_ups_status", columnList = "status"),
        @Index(name = "idx_follow_ups_scheduled_at", columnList = "scheduled_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FollowUpEntity {

    @Id
    private UUID id;

    @Column(name = "invoice_id", nullable = false)
    private UUID invoiceId;

    @Column(name = "template_id", nullable = false)
    private UUID templateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Channel channel;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FollowUpStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 16)
    private FailureKind failureKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "message_content", columnDefinition = "TEXT")
    private String messageContent;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Column(name = "response_data", columnDefinition = "TEXT")
    private String responseData;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public FollowUp toDomain() {
        return FollowUp.builder()
            .id(id)
            .invoiceId(invoiceId)
            .templateId(templateId)
            .channel(channel)
            .scheduledAt(scheduledAt)
            .status(status)
            .attemptCount(attemptCount)
            .claimedAt(claimedAt)
            .sentAt(sentAt)
            .deliveredAt(deliveredAt)
            .failedAt(failedAt)
            .failureKind(failureKind)
            .errorMessage(errorMessage)
            .messageContent(messageContent)
            .providerMessageId(providerMessageId)
            .responseData(responseData)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
