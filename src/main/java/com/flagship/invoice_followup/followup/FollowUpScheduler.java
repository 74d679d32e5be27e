package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic scan-and-dispatch tick.
 *
 * Safe to run on every instance at once: overlapping scans produce overlapping
 * candidates and the ledger claim lets exactly one of them send.
 */
@Component
@ConditionalOnProperty(name = "followup.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FollowUpScheduler {

    private final DueWindowScanner scanner;
    private final DispatchWorker worker;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${followup.scanner.interval-ms:300000}",
               initialDelayString = "${followup.scanner.initial-delay-ms:30000}")
    public void tick() {
        CorrelationContext.begin("scan");
        try {
            runOnce(clock.instant());
        } catch (Exception e) {
            log.error("Follow-up tick failed: {}", e.getMessage(), e);
        } finally {
            CorrelationContext.clear();
        }
    }

    /**
     * One scan followed by dispatch of everything it found.
     */
    public BatchResult runOnce(Instant now) {
        List<FollowUpCandidate> candidates = scanner.scan(now);
        if (candidates.isEmpty()) {
            log.debug("No follow-ups due");
            return BatchResult.of(List.of());
        }
        return worker.dispatchBatch(candidates, now);
    }
}
