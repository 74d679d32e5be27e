package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.company.CompanyEntity;
import com.flagship.invoice_followup.company.CompanyRepository;
import com.flagship.invoice_followup.invoice.Invoice;
import com.flagship.invoice_followup.invoice.InvoiceEntity;
import com.flagship.invoice_followup.invoice.InvoiceRepository;
import com.flagship.invoice_followup.invoice.InvoiceStatus;
import com.flagship.invoice_followup.observability.FollowUpMetrics;
import com.flagship.invoice_followup.template.MessageTemplate;
import com.flagship.invoice_followup.template.TemplateResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Finds the (invoice, template) pairs whose send window has opened and that the ledger
 * does not already account for.
 *
 * Read-only. Two scans racing over the same data may return the same candidate; the
 * claim in {@link DispatchWorker} decides which one sends.
 */
@Component
@Slf4j
public class DueWindowScanner {

    private final CompanyRepository companyRepository;
    private final InvoiceRepository invoiceRepository;
    private final TemplateResolver templateResolver;
    private final FollowUpLedger ledger;
    private final RetryPolicy retryPolicy;
    private final FollowUpMetrics metrics;
    private final ZoneId zone;
    private final int batchSize;

    public DueWindowScanner(CompanyRepository companyRepository,
                            InvoiceRepository invoiceRepository,
                            TemplateResolver templateResolver,
                            FollowUpLedger ledger,
                            RetryPolicy retryPolicy,
                            FollowUpMetrics metrics,
                            @Value("${followup.zone:UTC}") ZoneId zone,
                            @Value("${followup.scanner.batch-size:500}") int batchSize) {
        this.companyRepository = companyRepository;
        this.invoiceRepository = invoiceRepository;
        this.templateResolver = templateResolver;
        this.ledger = ledger;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.zone = zone;
        this.batchSize = batchSize;
    }

    /**
     * Candidates due at {@code now}, earliest window first, at most batch-size of them.
     */
    public List<FollowUpCandidate> scan(Instant now) {
        LocalDate today = localDate(now);
        List<FollowUpCandidate> candidates = new ArrayList<>();

        for (CompanyEntity company : companyRepository.findByPausedFalse()) {
            candidates.addAll(scanCompany(company, today, now));
        }

        candidates.sort(Comparator.comparing(FollowUpCandidate::getScheduledAt)
            .thenComparing(c -> c.getInvoice().getId()));
        List<FollowUpCandidate> batch = candidates.size() > batchSize
            ? List.copyOf(candidates.subList(0, batchSize))
            : candidates;

        metrics.recordScanCandidates(batch.size());
        log.info("Scan complete: now={}, candidates={}, returned={}", now, candidates.size(), batch.size());
        return batch;
    }

    /**
     * Instant at which a template's window opens for an invoice: start of
     * due date + day offset, in the configured zone.
     */
    public Instant windowOpensAt(Invoice invoice, MessageTemplate template) {
        return invoice.getDueDate().plusDays(template.getDayOffset()).atStartOfDay(zone).toInstant();
    }

    /**
     * Calendar date of {@code now} in the configured zone.
     */
    public LocalDate localDate(Instant now) {
        return now.atZone(zone).toLocalDate();
    }

    private List<FollowUpCandidate> scanCompany(CompanyEntity company, LocalDate today, Instant now) {
        List<MessageTemplate> templates = templateResolver.templatesFor(company.getId());
        if (templates.isEmpty()) {
            return List.of();
        }

        int minOffset = templates.stream().mapToInt(MessageTemplate::getDayOffset).min().orElse(0);
        int maxOffset = templates.stream().mapToInt(MessageTemplate::getDayOffset).max().orElse(0);
        // Coarse date bounds for the query; the exact window check below is authoritative.
        LocalDate dueTo = today.minusDays(minOffset);
        LocalDate dueFrom = today.minusDays(retryPolicy.getMaxLateness().toDays() + 1).minusDays(maxOffset);

        List<Invoice> invoices = invoiceRepository.findFollowUpEligible(
                company.getId(), InvoiceStatus.COLLECTIBLE, dueFrom, dueTo)
            .stream()
            .map(InvoiceEntity::toDomain)
            .filter(Invoice::acceptsFollowUps)
            .toList();
        if (invoices.isEmpty()) {
            return List.of();
        }

        Map<String, FollowUp> rows = new HashMap<>();
        for (FollowUp row : ledger.findByInvoices(invoices.stream().map(Invoice::getId).toList())) {
            rows.put(key(row.getInvoiceId(), row.getTemplateId()), row);
        }

        List<FollowUpCandidate> found = new ArrayList<>();
        for (Invoice invoice : invoices) {
            for (MessageTemplate template : templates) {
                Instant opensAt = windowOpensAt(invoice, template);
                if (!retryPolicy.isWindowOpen(opensAt, now)) {
                    continue;
                }
                FollowUp existing = rows.get(key(invoice.getId(), template.getId()));
                if (existing == null) {
                    found.add(FollowUpCandidate.first(invoice, template, company.getName(), opensAt));
                } else if (retryPolicy.allowsAnotherAttempt(existing, now)) {
                    found.add(FollowUpCandidate.retry(invoice, template, company.getName(), existing));
                }
            }
        }

        log.debug("Scanned company: companyId={}, invoices={}, templates={}, candidates={}",
            company.getId(), invoices.size(), templates.size(), found.size());
        return found;
    }

    private static String key(UUID invoiceId, UUID templateId) {
        return invoiceId + ":" + templateId;
    }
}
