package com.flagship.invoice_followup.invoice.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request body for toggling an invoice's follow-up exclusion.
 */
@Value
public class ExclusionRequest {

    @NotNull(message = "excluded is required")
    @JsonProperty("excluded")
    Boolean excluded;

    @JsonCreator
    public ExclusionRequest(@JsonProperty("excluded") Boolean excluded) {
        this.excluded = excluded;
    }
}
