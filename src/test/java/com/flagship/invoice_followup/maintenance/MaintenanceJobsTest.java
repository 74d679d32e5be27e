package com.flagship.invoice_followup.maintenance;

import com.flagship.invoice_followup.consumer.ProcessedEventRepository;
import com.flagship.invoice_followup.followup.DeliveryStats;
import com.flagship.invoice_followup.followup.FollowUpRepository;
import com.flagship.invoice_followup.followup.FollowUpService;
import com.flagship.invoice_followup.followup.FollowUpStatus;
import com.flagship.invoice_followup.outbox.OutboxEventRepository;
import com.flagship.invoice_followup.template.Channel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MaintenanceJobsTest {

    private static final Instant NOW = Instant.parse("2025-02-01T03:30:00Z");

    @Test
    @DisplayName("Cleanup deletes old published events and markers and archives old failures")
    void testRetentionCleanup() {
        OutboxEventRepository outbox = mock(OutboxEventRepository.class);
        ProcessedEventRepository processed = mock(ProcessedEventRepository.class);
        FollowUpRepository followUps = mock(FollowUpRepository.class);
        Instant cutoff = NOW.minus(Duration.ofDays(30));
        when(outbox.deletePublishedEventsBefore(cutoff)).thenReturn(12);
        when(processed.deleteEventsProcessedBefore(cutoff)).thenReturn(7);
        when(followUps.archiveFailedBefore(NOW.minus(Duration.ofDays(45)), NOW)).thenReturn(3);

        RetentionCleanupJob job = new RetentionCleanupJob(outbox, processed, followUps,
            Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofDays(30), Duration.ofDays(45));
        RetentionCleanupJob.CleanupResult result = job.cleanup();

        assertEquals(12, result.getOutboxEvents());
        assertEquals(7, result.getProcessedEvents());
        assertEquals(3, result.getFollowUpsArchived());
        verify(outbox).deletePublishedEventsBefore(cutoff);
        verify(processed).deleteEventsProcessedBefore(cutoff);
        verify(followUps).archiveFailedBefore(NOW.minus(Duration.ofDays(45)), NOW);
    }

    @Test
    @DisplayName("Weekly report reads seven days of stats")
    void testWeeklyReport() {
        FollowUpService service = mock(FollowUpService.class);
        when(service.stats(WeeklyReportJob.REPORT_DAYS)).thenReturn(new DeliveryStats(
            NOW.minus(Duration.ofDays(7)), 4,
            Map.of(FollowUpStatus.DELIVERED, 3L, FollowUpStatus.FAILED, 1L),
            Map.of(Channel.EMAIL, 4L)));

        new WeeklyReportJob(service).report();

        verify(service).stats(7);
    }
}
