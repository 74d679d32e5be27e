package com.flagship.invoice_followup.followup;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * When a send window counts as open and when a ledger row may be attempted again.
 *
 * Every retry path is bounded twice: by {@code maxAttempts} and by {@code maxLateness},
 * which also keeps reminders for long-past windows from going out at all.
 */
@Component
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration backoff;
    private final Duration staleClaimTimeout;
    private final Duration maxLateness;

    public RetryPolicy(@Value("${followup.retry.max-attempts:3}") int maxAttempts,
                       @Value("${followup.retry.backoff:1h}") Duration backoff,
                       @Value("${followup.retry.stale-claim-timeout:15m}") Duration staleClaimTimeout,
                       @Value("${followup.scanner.max-lateness:14d}") Duration maxLateness) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("followup.retry.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.staleClaimTimeout = staleClaimTimeout;
        this.maxLateness = maxLateness;
    }

    /**
     * True when {@code scheduledAt} has passed but by no more than the max lateness.
     */
    public boolean isWindowOpen(Instant scheduledAt, Instant now) {
        return !scheduledAt.isAfter(now) && !scheduledAt.isBefore(now.minus(maxLateness));
    }

    /**
     * Whether the scanner may offer this existing row for another attempt.
     */
    public boolean allowsAnotherAttempt(FollowUp row, Instant now) {
        if (row.getAttemptCount() >= maxAttempts) {
            return false;
        }
        return switch (row.getStatus()) {
            case SENT, DELIVERED, ARCHIVED -> false;
            case FAILED -> row.isRetryableFailure()
                && row.getFailedAt() != null
                && !row.getFailedAt().isAfter(now.minus(backoff));
            case PENDING -> row.getClaimedAt() != null
                && !row.getClaimedAt().isAfter(staleBefore(now));
        };
    }

    /**
     * PENDING claims at or before this instant are considered abandoned.
     */
    public Instant staleBefore(Instant now) {
        return now.minus(staleClaimTimeout);
    }
}
