package com.flagship.invoice_followup.maintenance;

import com.flagship.invoice_followup.followup.DeliveryStats;
import com.flagship.invoice_followup.followup.FollowUpService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs a seven-day delivery summary once a week.
 */
@Component
@ConditionalOnProperty(name = "maintenance.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WeeklyReportJob {

    static final int REPORT_DAYS = 7;

    private final FollowUpService followUpService;

    @Scheduled(cron = "${maintenance.weekly-report-cron:0 0 8 * * MON}")
    public void report() {
        DeliveryStats stats = followUpService.stats(REPORT_DAYS);
        log.info("Follow-up weekly report since {}: total={}, byStatus={}, byChannel={}, successRate={}",
            stats.getSince(), stats.getTotal(), stats.getByStatus(), stats.getByChannel(),
            String.format("%.1f%%", stats.getSuccessRate() * 100));
    }
}
