package com.flagship.invoice_followup.followup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_followup.followup.FailureKind;
import com.flagship.invoice_followup.followup.FollowUp;
import com.flagship.invoice_followup.followup.FollowUpStatus;
import com.flagship.invoice_followup.template.Channel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger row as exposed over REST. The rendered message body is left out.
 */
@Value
@Builder
public class FollowUpResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("template_id")
    UUID templateId;

    @JsonProperty("channel")
    Channel channel;

    @JsonProperty("scheduled_at")
    Instant scheduledAt;

    @JsonProperty("status")
    FollowUpStatus status;

    @JsonProperty("attempt_count")
    int attemptCount;

    @JsonProperty("sent_at")
    Instant sentAt;

    @JsonProperty("delivered_at")
    Instant deliveredAt;

    @JsonProperty("failed_at")
    Instant failedAt;

    @JsonProperty("failure_kind")
    FailureKind failureKind;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("provider_message_id")
    String providerMessageId;

    public static FollowUpResponse from(FollowUp followUp) {
        return FollowUpResponse.builder()
            .id(followUp.getId())
            .invoiceId(followUp.getInvoiceId())
            .templateId(followUp.getTemplateId())
            .channel(followUp.getChannel())
            .scheduledAt(followUp.getScheduledAt())
            .status(followUp.getStatus())
            .attemptCount(followUp.getAttemptCount())
            .sentAt(followUp.getSentAt())
            .deliveredAt(followUp.getDeliveredAt())
            .failedAt(followUp.getFailedAt())
            .failureKind(followUp.getFailureKind())
            .errorMessage(followUp.getErrorMessage())
            .providerMessageId(followUp.getProviderMessageId())
            .build();
    }
}
