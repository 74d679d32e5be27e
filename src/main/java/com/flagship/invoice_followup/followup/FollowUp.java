package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.template.Channel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One ledger row: the attempt history of a single (invoice, template) pair.
 *
 * Rows are updated in place by retries. {@code attemptCount} only grows, and every
 * conditional write is keyed on it, so it doubles as the optimistic version of the row.
 */
@Value
@Builder(toBuilder = true)
public class FollowUp {
    UUID id;
    UUID invoiceId;
    UUID templateId;
    Channel channel;
    Instant scheduledAt;
    FollowUpStatus status;
    int attemptCount;
    Instant claimedAt;
    Instant sentAt;
    Instant deliveredAt;
    Instant failedAt;
    FailureKind failureKind;
    String errorMessage;
    String messageContent;
    String providerMessageId;
    String responseData;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Row produced by a winning first claim.
     */
    public static FollowUp claimedFirst(UUID id, UUID invoiceId, UUID templateId, Channel channel,
                                        Instant scheduledAt, Instant now) {
        return FollowUp.builder()
            .id(id)
            .invoiceId(invoiceId)
            .templateId(templateId)
            .channel(channel)
            .scheduledAt(scheduledAt)
            .status(FollowUpStatus.PENDING)
            .attemptCount(1)
            .claimedAt(now)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * This row re-claimed for its next attempt. Failure details of the previous attempt are cleared.
     */
    public FollowUp reclaimed(Instant now) {
        return toBuilder()
            .status(FollowUpStatus.PENDING)
            .attemptCount(attemptCount + 1)
            .claimedAt(now)
            .failedAt(null)
            .failureKind(null)
            .errorMessage(null)
            .updatedAt(now)
            .build();
    }

    public FollowUp sent(String providerMessageId, String responseData, String messageContent, Instant now) {
        if (status != FollowUpStatus.PENDING) {
            throw new IllegalStateException("Only a claimed follow-up can be marked sent, was " + status);
        }
        return toBuilder()
            .status(FollowUpStatus.SENT)
            .sentAt(now)
            .providerMessageId(providerMessageId)
            .responseData(responseData)
            .messageContent(messageContent)
            .updatedAt(now)
            .build();
    }

    public FollowUp failed(FailureKind kind, String errorMessage, String messageContent, Instant now) {
        if (status != FollowUpStatus.PENDING) {
            throw new IllegalStateException("Only a claimed follow-up can be marked failed, was " + status);
        }
        return toBuilder()
            .status(FollowUpStatus.FAILED)
            .failedAt(now)
            .failureKind(kind)
            .errorMessage(errorMessage)
            .messageContent(messageContent)
            .updatedAt(now)
            .build();
    }

    public FollowUp delivered(Instant at) {
        if (status != FollowUpStatus.SENT) {
            throw new IllegalStateException("Only a sent follow-up can be marked delivered, was " + status);
        }
        return toBuilder()
            .status(FollowUpStatus.DELIVERED)
            .deliveredAt(at)
            .updatedAt(at)
            .build();
    }

    public boolean isRetryableFailure() {
        return status == FollowUpStatus.FAILED && failureKind == FailureKind.TRANSIENT;
    }
}
