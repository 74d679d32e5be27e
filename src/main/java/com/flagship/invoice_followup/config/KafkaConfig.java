package com.flagship.invoice_followup.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by this service.
 *
 * - followup-events: lifecycle events relayed from the outbox
 * - followup-delivery-receipts: delivery confirmations pushed by channel providers
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:followup-events}")
    private String eventsTopic;

    @Value("${kafka.topic.delivery-receipts:followup-delivery-receipts}")
    private String deliveryReceiptsTopic;

    /**
     * Partitioned by aggregate id, so events for one follow-up stay ordered.
     */
    @Bean
    public NewTopic followUpEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic deliveryReceiptsTopic() {
        return TopicBuilder.name(deliveryReceiptsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
