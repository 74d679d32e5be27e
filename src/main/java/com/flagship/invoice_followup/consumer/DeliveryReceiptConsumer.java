package com.flagship.invoice_followup.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes provider delivery receipts.
 *
 * Offsets are acknowledged manually, after the receipt has been applied and recorded.
 * Unparseable messages are acknowledged and dropped; they would fail forever.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DeliveryReceiptConsumer {

    static final String CONSUMER_GROUP = "followup-receipt-consumer";
    private static final String AGGREGATE_TYPE = "FollowUp";

    private final IdempotentEventProcessor eventProcessor;
    private final DeliveryReceiptHandler receiptHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.delivery-receipts:followup-delivery-receipts}",
        groupId = "${spring.kafka.consumer.group-id:invoice-followup-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received receipt: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        DeliveryReceipt receipt = parse(record.value());
        if (receipt == null) {
            log.warn("Could not parse delivery receipt at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            if (receipt.isDelivered()) {
                eventProcessor.processEvent(
                    receipt.getReceiptId(), DeliveryReceipt.EVENT_TYPE,
                    AGGREGATE_TYPE, receipt.getFollowUpId(),
                    CONSUMER_GROUP,
                    () -> receiptHandler.onDelivered(receipt));
            } else {
                eventProcessor.skipEvent(
                    receipt.getReceiptId(), DeliveryReceipt.EVENT_TYPE,
                    AGGREGATE_TYPE, receipt.getFollowUpId(),
                    CONSUMER_GROUP, "Receipt status " + receipt.getStatus() + " not tracked");
            }
            ack.acknowledge();

        } catch (Exception e) {
            log.error("Error processing receipt at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged: redelivered.
            throw e;
        }
    }

    private DeliveryReceipt parse(String json) {
        try {
            DeliveryReceipt receipt = objectMapper.readValue(json, DeliveryReceipt.class);
            if (receipt.getReceiptId() == null || receipt.getProviderMessageId() == null) {
                return null;
            }
            return receipt;
        } catch (Exception e) {
            log.error("Failed to parse delivery receipt: {}", e.getMessage());
            return null;
        }
    }
}
