package com.flagship.invoice_followup.outbox;

import com.flagship.invoice_followup.event.CredentialRevokedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox relay to Kafka.
 *
 * These tests verify that:
 * - Events are published to the events topic and marked as published
 * - The aggregate id is the message key, so one aggregate's events stay ordered
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("invoice_followup_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("credential.vault.secret", () -> "integration-test-secret");
        // Publisher bean stays, but we trigger it manually
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("consumer.enabled", () -> "false");
        registry.add("followup.scheduler.enabled", () -> "false");
        registry.add("credential.refresh.sweep.enabled", () -> "false");
        registry.add("maintenance.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Value("${kafka.topic.events:followup-events}")
    private String eventsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(eventsTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Topic: " + eventsTopic);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private UUID revoke() {
        UUID ownerId = UUID.randomUUID();
        transactionTemplate.executeWithoutResult(status -> outboxService.saveEvent(
            CredentialRevokedEvent.of(ownerId, "invalid_grant", Instant.now())));
        return ownerId;
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Publisher sends events to Kafka keyed by aggregate id and marks them published")
    void testPublisher_SendsToKafka() {
        printTestHeader("Publisher Sends Events to Kafka");

        List<UUID> owners = List.of(revoke(), revoke(), revoke());
        assertEquals(3, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished(), "All events should be published");

        List<ConsumerRecord<String, String>> records = consumeRecords(3, 10_000);
        System.out.println("Records received: " + records.size());
        assertEquals(3, records.size());

        for (ConsumerRecord<String, String> record : records) {
            System.out.println("Key: " + record.key() + ", Partition: " + record.partition());
            assertTrue(owners.stream().anyMatch(id -> id.toString().equals(record.key())),
                "Key should be an owner id");
            assertTrue(record.value().contains(CredentialRevokedEvent.EVENT_TYPE));
        }

        printSuccess("Events published and marked");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                allRecords.add(record);
            }
        }

        return allRecords;
    }
}
