package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.template.Channel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");

    private final RetryPolicy policy = FollowUpFixtures.defaultRetryPolicy();

    private FollowUp pending(Instant claimedAt) {
        return FollowUp.claimedFirst(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            Channel.EMAIL, NOW.minus(Duration.ofDays(1)), claimedAt);
    }

    @Test
    @DisplayName("Window is open from its start until max lateness has passed")
    void testWindowBounds() {
        assertTrue(policy.isWindowOpen(NOW, NOW));
        assertFalse(policy.isWindowOpen(NOW.plusSeconds(1), NOW));
        assertTrue(policy.isWindowOpen(NOW.minus(Duration.ofDays(14)), NOW));
        assertFalse(policy.isWindowOpen(NOW.minus(Duration.ofDays(14)).minusSeconds(1), NOW));
    }

    @Test
    @DisplayName("Delivered rows are final")
    void testDeliveredRows_NeverRetried() {
        FollowUp sent = pending(NOW.minus(Duration.ofDays(1))).sent("p-1", null, "body", NOW.minus(Duration.ofDays(1)));
        assertFalse(policy.allowsAnotherAttempt(sent, NOW));
        assertFalse(policy.allowsAnotherAttempt(sent.delivered(NOW), NOW));
    }

    @Test
    @DisplayName("Archived failures are final")
    void testArchivedRows_NeverRetried() {
        Instant failedAt = NOW.minus(Duration.ofDays(31));
        FollowUp archived = pending(failedAt).failed(FailureKind.TRANSIENT, "503", null, failedAt)
            .toBuilder().status(FollowUpStatus.ARCHIVED).build();
        assertFalse(policy.allowsAnotherAttempt(archived, NOW));
    }

    @Test
    @DisplayName("Transient failure is retried after backoff, validation failure never")
    void testFailureKinds() {
        Instant failedAt = NOW.minus(Duration.ofHours(2));
        FollowUp transientFailure = pending(failedAt).failed(FailureKind.TRANSIENT, "503", null, failedAt);
        FollowUp validation = pending(failedAt).failed(FailureKind.VALIDATION, "no email", null, failedAt);

        assertTrue(policy.allowsAnotherAttempt(transientFailure, NOW));
        assertFalse(policy.allowsAnotherAttempt(transientFailure, failedAt.plus(Duration.ofMinutes(59))));
        assertFalse(policy.allowsAnotherAttempt(validation, NOW));
    }

    @Test
    @DisplayName("Stale PENDING claims are recoverable, live ones are not")
    void testStaleClaims() {
        assertTrue(policy.allowsAnotherAttempt(pending(NOW.minus(Duration.ofMinutes(15))), NOW));
        assertFalse(policy.allowsAnotherAttempt(pending(NOW.minus(Duration.ofMinutes(14))), NOW));
    }

    @Test
    @DisplayName("Invalid max attempts is rejected")
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ofHours(1), Duration.ofMinutes(15), Duration.ofDays(14)));
    }
}
