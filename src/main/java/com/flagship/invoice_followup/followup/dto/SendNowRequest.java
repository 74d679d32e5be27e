package com.flagship.invoice_followup.followup.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class SendNowRequest {

    @NotNull(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    UUID invoiceId;

    @NotNull(message = "Template ID is required")
    @JsonProperty("template_id")
    UUID templateId;

    @JsonCreator
    public SendNowRequest(@JsonProperty("invoice_id") UUID invoiceId,
                          @JsonProperty("template_id") UUID templateId) {
        this.invoiceId = invoiceId;
        this.templateId = templateId;
    }
}
