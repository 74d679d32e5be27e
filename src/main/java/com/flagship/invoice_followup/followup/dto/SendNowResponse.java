package com.flagship.invoice_followup.followup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_followup.followup.DispatchOutcome;
import lombok.Value;

@Value
public class SendNowResponse {

    @JsonProperty("outcome")
    DispatchOutcome outcome;

    @JsonProperty("follow_up")
    FollowUpResponse followUp;
}
