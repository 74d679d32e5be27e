package com.flagship.invoice_followup.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_followup.invoice.Invoice;
import com.flagship.invoice_followup.invoice.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("external_invoice_id")
    String externalInvoiceId;

    @JsonProperty("customer_name")
    String customerName;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("excluded")
    boolean excluded;

    @JsonProperty("last_followup_at")
    Instant lastFollowUpAt;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .companyId(invoice.getCompanyId())
            .externalInvoiceId(invoice.getExternalInvoiceId())
            .customerName(invoice.getCustomerName())
            .amount(invoice.getAmount())
            .currency(invoice.getCurrency())
            .dueDate(invoice.getDueDate())
            .status(invoice.getStatus())
            .excluded(invoice.isExcluded())
            .lastFollowUpAt(invoice.getLastFollowUpAt())
            .build();
    }
}
