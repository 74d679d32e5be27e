package com.flagship.invoice_followup.channel;

import com.flagship.invoice_followup.template.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes a message to the provider for its channel and bounds the call with a timeout.
 *
 * Failures come out as {@link DeliveryException} only: timeouts, interrupts and
 * unclassified provider errors become {@link TransientDeliveryException}.
 */
@Component
@Slf4j
public class ChannelRouter {

    private final Map<Channel, ChannelProvider> providers = new EnumMap<>(Channel.class);
    private final ExecutorService providerCallExecutor;
    private final Duration timeout;

    @Autowired
    public ChannelRouter(ObjectProvider<ChannelProvider> registered,
                         @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                         @Value("${followup.dispatch.provider-timeout:30s}") Duration timeout) {
        this(registered.orderedStream().toList(), providerCallExecutor, timeout);
    }

    public ChannelRouter(List<ChannelProvider> registered,
                         ExecutorService providerCallExecutor,
                         Duration timeout) {
        for (ChannelProvider provider : registered) {
            ChannelProvider previous = providers.put(provider.channel(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two providers registered for channel " + provider.channel()
                    + ": " + previous.getClass().getName() + ", " + provider.getClass().getName());
            }
        }
        for (Channel channel : Channel.values()) {
            providers.computeIfAbsent(channel, c -> {
                log.warn("No provider registered for channel {}, falling back to logging provider", c);
                return new LoggingChannelProvider(c);
            });
        }
        this.providerCallExecutor = providerCallExecutor;
        this.timeout = timeout;
    }

    public DeliveryResult send(OutboundMessage message) {
        ChannelProvider provider = providers.get(message.getChannel());
        Future<DeliveryResult> call = providerCallExecutor.submit(() -> provider.send(message));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TransientDeliveryException("Provider timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientDeliveryException("Interrupted while waiting for provider", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DeliveryException deliveryException) {
                throw deliveryException;
            }
            throw new TransientDeliveryException("Provider error: " + cause, cause);
        }
    }
}
