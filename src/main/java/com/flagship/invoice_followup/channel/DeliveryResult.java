package com.flagship.invoice_followup.channel;

import lombok.Value;

/**
 * Provider acknowledgement of an accepted message.
 */
@Value
public class DeliveryResult {
    String providerMessageId;
    /** Raw provider response as JSON, kept for audits. May be null. */
    String responseData;
}
