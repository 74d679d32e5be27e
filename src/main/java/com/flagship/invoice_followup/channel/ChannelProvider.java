package com.flagship.invoice_followup.channel;

import com.flagship.invoice_followup.template.Channel;

/**
 * Capability to deliver a message over one channel.
 *
 * Implementations are vendor adapters (an email API, an SMS gateway). They must classify
 * failures: {@link TransientDeliveryException} when a later attempt may succeed,
 * {@link PermanentDeliveryException} otherwise. Any other runtime exception is treated
 * as transient by the caller.
 */
public interface ChannelProvider {

    Channel channel();

    DeliveryResult send(OutboundMessage message);
}
