package com.flagship.invoice_followup.maintenance;

import com.flagship.invoice_followup.consumer.ProcessedEventRepository;
import com.flagship.invoice_followup.followup.FollowUpRepository;
import com.flagship.invoice_followup.outbox.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Daily housekeeping.
 *
 * Deletes published outbox events and processed-event markers older than the retention
 * period. Unpublished and dead-lettered outbox rows are never removed here. FAILED
 * follow-ups whose last failure is older than {@code maintenance.archive-failed-after} are
 * moved to ARCHIVED; SENT and DELIVERED rows stay, they are what stops a re-send.
 */
@Component
@ConditionalOnProperty(name = "maintenance.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RetentionCleanupJob {

    private final OutboxEventRepository outboxEventRepository;
    private final ProcessedEventRepository processedEventRepository;
    private final FollowUpRepository followUpRepository;
    private final Clock clock;
    private final Duration retention;
    private final Duration archiveFailedAfter;

    public RetentionCleanupJob(OutboxEventRepository outboxEventRepository,
                               ProcessedEventRepository processedEventRepository,
                               FollowUpRepository followUpRepository,
                               Clock clock,
                               @Value("${maintenance.retention:30d}") Duration retention,
                               @Value("${maintenance.archive-failed-after:30d}") Duration archiveFailedAfter) {
        this.outboxEventRepository = outboxEventRepository;
        this.processedEventRepository = processedEventRepository;
        this.followUpRepository = followUpRepository;
        this.clock = clock;
        this.retention = retention;
        this.archiveFailedAfter = archiveFailedAfter;
    }

    @Scheduled(cron = "${maintenance.cleanup-cron:0 30 3 * * *}")
    @Transactional
    public void scheduledCleanup() {
        cleanup();
    }

    @Transactional
    public CleanupResult cleanup() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(retention);
        int outbox = outboxEventRepository.deletePublishedEventsBefore(cutoff);
        int processed = processedEventRepository.deleteEventsProcessedBefore(cutoff);
        int archived = followUpRepository.archiveFailedBefore(now.minus(archiveFailedAfter), now);
        if (outbox > 0 || processed > 0 || archived > 0) {
            log.info("Daily cleanup: outboxEvents={}, processedEvents={}, followUpsArchived={}",
                outbox, processed, archived);
        }
        return new CleanupResult(outbox, processed, archived);
    }

    @lombok.Value
    public static class CleanupResult {
        int outboxEvents;
        int processedEvents;
        int followUpsArchived;
    }
}
