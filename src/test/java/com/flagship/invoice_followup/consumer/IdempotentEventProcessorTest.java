package com.flagship.invoice_followup.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent message handling against PostgreSQL.
 *
 * These tests verify that:
 * - A message is handled once per consumer group
 * - Duplicates are ignored
 * - A failing handler leaves no marker, so the message is handled on redelivery
 * - Skipped messages are remembered too
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("invoice_followup_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("credential.vault.secret", () -> "integration-test-secret");
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("followup.scheduler.enabled", () -> "false");
        registry.add("credential.refresh.sweep.enabled", () -> "false");
        registry.add("maintenance.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = DeliveryReceipt.EVENT_TYPE;
    private static final String AGGREGATE_TYPE = "FollowUp";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
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
    @DisplayName("Duplicate message does not run the handler again")
    void testDuplicateEvent_SkipsHandler() {
        printTestHeader("Duplicate Event - Skips Handler");

        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean first = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet
        );
        boolean second = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet
        );

        System.out.println("First processed: " + first + ", second processed: " + second);

        assertTrue(first, "First event should be processed");
        assertFalse(second, "Duplicate should be skipped");
        assertEquals(1, handlerCallCount.get(), "Handler should only be called once");
        assertTrue(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP));

        printSuccess("Duplicate events correctly skipped");
    }

    @Test
    @DisplayName("Same message is handled independently by each consumer group")
    void testDifferentConsumerGroups_ProcessSameEvent() {
        printTestHeader("Different Consumer Groups - Process Same Event");

        UUID eventId = UUID.randomUUID();
        AtomicInteger totalCalls = new AtomicInteger(0);

        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, null,
            "receipt-consumer", totalCalls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, null,
            "analytics-consumer", totalCalls::incrementAndGet));

        assertEquals(2, totalCalls.get());
        assertEquals(1, repository.countByConsumerGroup("receipt-consumer"));
        assertEquals(1, repository.countByConsumerGroup("analytics-consumer"));

        printSuccess("Each consumer group kept its own marker");
    }

    @Test
    @DisplayName("Failing handler leaves no marker so redelivery is handled")
    void testFailedProcessing_NoMarker() {
        printTestHeader("Failed Processing - No Marker");

        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, null, CONSUMER_GROUP,
            () -> {
                throw new IllegalStateException("Simulated processing failure");
            }
        ));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        boolean redelivered = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, null, CONSUMER_GROUP, handlerCallCount::incrementAndGet);

        assertTrue(redelivered);
        assertEquals(1, handlerCallCount.get());

        printSuccess("Redelivery handled after failure");
    }

    @Test
    @DisplayName("Skipped message is remembered and not handled later")
    void testSkippedEvent_Remembered() {
        printTestHeader("Skipped Event");

        UUID eventId = UUID.randomUUID();
        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, null, CONSUMER_GROUP, "status OPENED");
        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, null, CONSUMER_GROUP, "status OPENED");

        AtomicInteger calls = new AtomicInteger();
        assertFalse(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, null,
            CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(0, calls.get());

        ProcessedEventEntity entity = repository.findById(new ProcessedEventEntity.Key(eventId, CONSUMER_GROUP))
            .orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
        assertEquals("status OPENED", entity.getNote());

        printSuccess("Skip marker prevents later handling");
    }
}
