package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.exception.ResourceNotFoundException;
import com.flagship.invoice_followup.invoice.InvoiceRepository;
import com.flagship.invoice_followup.template.Channel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-side queries over the ledger for the admin API and the weekly report.
 */
@Service
@RequiredArgsConstructor
public class FollowUpService {

    private final FollowUpRepository followUpRepository;
    private final InvoiceRepository invoiceRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<FollowUp> historyFor(UUID invoiceId) {
        if (!invoiceRepository.existsById(invoiceId)) {
            throw new ResourceNotFoundException("Invoice", invoiceId);
        }
        return followUpRepository.findByInvoiceIdOrderByScheduledAtAsc(invoiceId).stream()
            .map(FollowUpEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public FollowUp getFollowUp(UUID followUpId) {
        return followUpRepository.findById(followUpId)
            .map(FollowUpEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("FollowUp", followUpId));
    }

    /**
     * Row counts by status and channel for rows touched in the last {@code days} days.
     */
    @Transactional(readOnly = true)
    public DeliveryStats stats(int days) {
        if (days < 1 || days > 365) {
            throw new IllegalArgumentException("days must be between 1 and 365");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));

        Map<FollowUpStatus, Long> byStatus = new EnumMap<>(FollowUpStatus.class);
        Map<Channel, Long> byChannel = new EnumMap<>(Channel.class);
        long total = 0;
        for (FollowUpRepository.StatusChannelCount row : followUpRepository.countByStatusAndChannelSince(since)) {
            byStatus.merge(row.getStatus(), row.getTotal(), Long::sum);
            byChannel.merge(row.getChannel(), row.getTotal(), Long::sum);
            total += row.getTotal();
        }
        return new DeliveryStats(since, total, byStatus, byChannel);
    }
}
