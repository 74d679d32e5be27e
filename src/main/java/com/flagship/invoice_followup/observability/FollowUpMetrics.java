package com.flagship.invoice_followup.observability;

import com.flagship.invoice_followup.followup.FollowUpRepository;
import com.flagship.invoice_followup.followup.FollowUpStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the follow-up engine and the credential refresher.
 *
 * - followup.dispatch{channel,outcome}: one count per dispatch attempt
 * - followup.dispatch.latency{channel}: claim to recorded outcome
 * - followup.scan.candidates: candidates produced per scan
 * - credential.refresh{outcome}: refresh attempts
 * - followup.ledger.rows{status}: gauges, refreshed by {@link MetricsScheduler}
 */
@Component
@Slf4j
public class FollowUpMetrics {

    private final MeterRegistry registry;
    private final FollowUpRepository followUpRepository;

    private final AtomicLong pendingRows = new AtomicLong(0);
    private final AtomicLong failedRows = new AtomicLong(0);

    public FollowUpMetrics(MeterRegistry registry, FollowUpRepository followUpRepository) {
        this.registry = registry;
        this.followUpRepository = followUpRepository;

        Gauge.builder("followup.ledger.rows", pendingRows, AtomicLong::get)
                .description("Ledger rows currently claimed and in flight")
                .tag("status", "pending")
                .register(registry);

        Gauge.builder("followup.ledger.rows", failedRows, AtomicLong::get)
                .description("Ledger rows whose last attempt failed")
                .tag("status", "failed")
                .register(registry);
    }

    public void recordDispatch(String channel, String outcome) {
        registry.counter("followup.dispatch",
                "channel", sanitizeTag(channel),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDispatchLatency(String channel, Duration duration) {
        registry.timer("followup.dispatch.latency",
                "channel", sanitizeTag(channel)
        ).record(duration);
    }

    public void recordScanCandidates(int count) {
        registry.summary("followup.scan.candidates").record(count);
    }

    public void recordCredentialRefresh(String outcome) {
        registry.counter("credential.refresh",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordReceiptProcessed(String receiptStatus, boolean wasNew) {
        registry.counter("followup.receipts",
                "status", sanitizeTag(receiptStatus),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void refreshLedgerGauges() {
        try {
            pendingRows.set(followUpRepository.countByStatus(FollowUpStatus.PENDING));
            failedRows.set(followUpRepository.countByStatus(FollowUpStatus.FAILED));
        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
