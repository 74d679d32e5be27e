package com.flagship.invoice_followup.channel;

import com.flagship.invoice_followup.template.Channel;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A rendered reminder ready for a channel provider.
 *
 * {@code followUpId} is passed to providers that accept a client reference, so a
 * provider-side retry can be deduplicated on their end too.
 */
@Value
@Builder
public class OutboundMessage {
    UUID followUpId;
    Channel channel;
    String recipient;
    String subject;
    String body;
}
