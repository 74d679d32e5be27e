package com.flagship.invoice_followup.channel;

import com.flagship.invoice_followup.template.Channel;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Provider that logs instead of sending. Registered for every channel that has no real
 * provider bean, so local and test environments work without vendor accounts.
 */
@Slf4j
public class LoggingChannelProvider implements ChannelProvider {

    private final Channel channel;

    public LoggingChannelProvider(Channel channel) {
        this.channel = channel;
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public DeliveryResult send(OutboundMessage message) {
        String providerMessageId = "log-" + UUID.randomUUID();
        log.info("[{}] Would deliver follow-up: followUpId={}, recipient={}, subject={}, providerMessageId={}",
            channel, message.getFollowUpId(), message.getRecipient(), message.getSubject(), providerMessageId);
        return new DeliveryResult(providerMessageId, "{\"provider\":\"logging\"}");
    }
}
