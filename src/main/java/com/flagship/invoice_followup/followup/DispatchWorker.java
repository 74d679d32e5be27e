package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.channel.ChannelRouter;
import com.flagship.invoice_followup.channel.DeliveryResult;
import com.flagship.invoice_followup.channel.OutboundMessage;
import com.flagship.invoice_followup.channel.PermanentDeliveryException;
import com.flagship.invoice_followup.channel.TransientDeliveryException;
import com.flagship.invoice_followup.company.CompanyEntity;
import com.flagship.invoice_followup.company.CompanyRepository;
import com.flagship.invoice_followup.exception.ResourceNotFoundException;
import com.flagship.invoice_followup.invoice.Invoice;
import com.flagship.invoice_followup.invoice.InvoiceEntity;
import com.flagship.invoice_followup.invoice.InvoiceRepository;
import com.flagship.invoice_followup.observability.CorrelationContext;
import com.flagship.invoice_followup.observability.FollowUpMetrics;
import com.flagship.invoice_followup.template.Channel;
import com.flagship.invoice_followup.template.MessageTemplate;
import com.flagship.invoice_followup.template.RenderContext;
import com.flagship.invoice_followup.template.RenderedMessage;
import com.flagship.invoice_followup.template.TemplateResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Executes follow-up candidates: claim, render, send, record.
 *
 * The claim is the only serialization point. A worker that loses it does nothing, so
 * any number of workers may dispatch overlapping scans. Every per-job failure ends up in
 * the ledger; nothing thrown by one job reaches the batch or the scheduler.
 */
@Component
@Slf4j
public class DispatchWorker {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9][0-9 ()-]{5,19}$");

    private final FollowUpLedger ledger;
    private final TemplateResolver templateResolver;
    private final ChannelRouter channelRouter;
    private final RetryPolicy retryPolicy;
    private final DueWindowScanner scanner;
    private final InvoiceRepository invoiceRepository;
    private final CompanyRepository companyRepository;
    private final FollowUpMetrics metrics;
    private final Clock clock;
    private final ExecutorService dispatchExecutor;

    public DispatchWorker(FollowUpLedger ledger,
                          TemplateResolver templateResolver,
                          ChannelRouter channelRouter,
                          RetryPolicy retryPolicy,
                          DueWindowScanner scanner,
                          InvoiceRepository invoiceRepository,
                          CompanyRepository companyRepository,
                          FollowUpMetrics metrics,
                          Clock clock,
                          @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor) {
        this.ledger = ledger;
        this.templateResolver = templateResolver;
        this.channelRouter = channelRouter;
        this.retryPolicy = retryPolicy;
        this.scanner = scanner;
        this.invoiceRepository = invoiceRepository;
        this.companyRepository = companyRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Dispatches candidates in parallel and waits for all of them.
     */
    public BatchResult dispatchBatch(List<FollowUpCandidate> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return BatchResult.of(List.of());
        }
        String correlationId = CorrelationContext.getCorrelationId();

        List<CompletableFuture<DispatchOutcome>> futures = candidates.stream()
            .map(candidate -> CompletableFuture.supplyAsync(() -> {
                MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
                try {
                    return dispatch(candidate, now);
                } catch (RuntimeException e) {
                    log.error("Unexpected dispatch error: invoiceId={}, templateId={}",
                        candidate.getInvoice().getId(), candidate.getTemplate().getId(), e);
                    return DispatchOutcome.ERROR;
                } finally {
                    MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
                }
            }, dispatchExecutor))
            .toList();

        BatchResult result = BatchResult.of(futures.stream().map(CompletableFuture::join).toList());
        log.info("Dispatch batch complete: {}", result);
        return result;
    }

    /**
     * Claims and executes one candidate.
     *
     * @param now the scan time the candidate was selected at; the claim itself is stamped
     *            with the clock's current time, which may be well past it for a queued task
     */
    public DispatchOutcome dispatch(FollowUpCandidate candidate, Instant now) {
        Invoice invoice = candidate.getInvoice();
        MessageTemplate template = candidate.getTemplate();
        Channel channel = template.getChannel();

        Instant claimedAt = clock.instant();
        Optional<FollowUp> claim = ledger.claim(candidate, claimedAt, retryPolicy.staleBefore(claimedAt));
        if (claim.isEmpty()) {
            log.debug("Claim lost: invoiceId={}, templateId={}, observedAttempt={}",
                invoice.getId(), template.getId(), candidate.getObservedAttempt());
            metrics.recordDispatch(channel.name(), DispatchOutcome.CLAIM_CONFLICT.name());
            return DispatchOutcome.CLAIM_CONFLICT;
        }

        FollowUp claimed = claim.get();
        MDC.put(CorrelationContext.FOLLOW_UP_ID_MDC_KEY, claimed.getId().toString());
        try {
            DispatchOutcome outcome = execute(candidate, claimed, now);
            metrics.recordDispatch(channel.name(), outcome.name());
            metrics.recordDispatchLatency(channel.name(), Duration.between(claimedAt, clock.instant()));
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.FOLLOW_UP_ID_MDC_KEY);
        }
    }

    /**
     * Sends one reminder immediately, regardless of its window or retry backoff.
     *
     * Still goes through the claim: a pair that is already SENT or DELIVERED is refused,
     * and a claim held by a live worker wins over this request.
     */
    public DispatchOutcome sendNow(UUID invoiceId, UUID templateId) {
        Invoice invoice = invoiceRepository.findById(invoiceId)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        if (invoice.isExcluded()) {
            throw new IllegalStateException("Invoice " + invoiceId + " is excluded from follow-ups");
        }
        if (!invoice.getStatus().isCollectible()) {
            throw new IllegalStateException("Invoice " + invoiceId + " is " + invoice.getStatus());
        }

        CompanyEntity company = companyRepository.findById(invoice.getCompanyId())
            .orElseThrow(() -> new ResourceNotFoundException("Company", invoice.getCompanyId()));
        MessageTemplate template = templateResolver.getTemplate(templateId);
        if (!template.isGlobal() && !template.getCompanyId().equals(company.getId())) {
            throw new IllegalArgumentException("Template " + templateId + " belongs to another company");
        }

        Optional<FollowUp> existing = ledger.find(invoiceId, templateId);
        if (existing.isPresent() && existing.get().getStatus() == FollowUpStatus.ARCHIVED) {
            throw new IllegalStateException("Follow-up for invoice " + invoiceId + " and template " + templateId
                + " was archived after failing");
        }
        if (existing.isPresent() && existing.get().getStatus().isDelivered()) {
            throw new IllegalStateException("Follow-up already " + existing.get().getStatus()
                + " for invoice " + invoiceId + " and template " + templateId);
        }

        FollowUpCandidate candidate = existing
            .map(row -> FollowUpCandidate.retry(invoice, template, company.getName(), row))
            .orElseGet(() -> FollowUpCandidate.first(invoice, template, company.getName(),
                scanner.windowOpensAt(invoice, template)));

        log.info("Manual send requested: invoiceId={}, templateId={}, observedAttempt={}",
            invoiceId, templateId, candidate.getObservedAttempt());
        return dispatch(candidate, clock.instant());
    }

    private DispatchOutcome execute(FollowUpCandidate candidate, FollowUp claimed, Instant now) {
        Invoice invoice = candidate.getInvoice();
        MessageTemplate template = candidate.getTemplate();
        String content = null;
        DeliveryResult result;

        try {
            RenderedMessage rendered = templateResolver.render(template,
                RenderContext.of(invoice, candidate.getCompanyName(), scanner.localDate(now)));
            content = rendered.getBody();
            if (content.isBlank()) {
                throw new FollowUpValidationException("Template " + template.getId() + " rendered an empty body");
            }

            OutboundMessage message = OutboundMessage.builder()
                .followUpId(claimed.getId())
                .channel(template.getChannel())
                .recipient(recipientFor(invoice, template.getChannel()))
                .subject(rendered.getSubject())
                .body(content)
                .build();

            result = channelRouter.send(message);

        } catch (FollowUpValidationException e) {
            log.warn("Follow-up not deliverable: invoiceId={}, reason={}", invoice.getId(), e.getMessage());
            return recordFailure(claimed, FailureKind.VALIDATION, e.getMessage(), content);
        } catch (PermanentDeliveryException e) {
            log.warn("Provider rejected follow-up: invoiceId={}, reason={}", invoice.getId(), e.getMessage());
            return recordFailure(claimed, FailureKind.PERMANENT, e.getMessage(), content);
        } catch (TransientDeliveryException e) {
            log.warn("Transient delivery failure: invoiceId={}, attempt={}, reason={}",
                invoice.getId(), claimed.getAttemptCount(), e.getMessage());
            return recordFailure(claimed, FailureKind.TRANSIENT, e.getMessage(), content);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while sending: invoiceId={}", invoice.getId(), e);
            return recordFailure(claimed, FailureKind.TRANSIENT, e.toString(), content);
        }

        try {
            if (!ledger.markSent(claimed, result, content, clock.instant())) {
                log.warn("Sent, but claim was superseded before recording: attempt={}", claimed.getAttemptCount());
                return DispatchOutcome.SUPERSEDED;
            }
            log.info("Follow-up sent: invoiceId={}, channel={}, attempt={}, providerMessageId={}",
                invoice.getId(), template.getChannel(), claimed.getAttemptCount(), result.getProviderMessageId());
            return DispatchOutcome.SENT;
        } catch (RuntimeException e) {
            log.error("Sent, but recording the outcome failed; row stays PENDING: invoiceId={}",
                invoice.getId(), e);
            return DispatchOutcome.ERROR;
        }
    }

    private DispatchOutcome recordFailure(FollowUp claimed, FailureKind kind, String reason, String content) {
        try {
            if (!ledger.markFailed(claimed, kind, reason, content, clock.instant())) {
                log.warn("Failure not recorded, claim was superseded: attempt={}", claimed.getAttemptCount());
                return DispatchOutcome.SUPERSEDED;
            }
            return DispatchOutcome.forFailure(kind);
        } catch (RuntimeException e) {
            log.error("Recording the failure failed; row stays PENDING: followUpId={}", claimed.getId(), e);
            return DispatchOutcome.ERROR;
        }
    }

    static String recipientFor(Invoice invoice, Channel channel) {
        return switch (channel) {
            case EMAIL -> {
                String email = invoice.getCustomerEmail();
                if (email == null || !EMAIL.matcher(email.trim()).matches()) {
                    throw new FollowUpValidationException("No valid email address for invoice " + invoice.getId());
                }
                yield email.trim();
            }
            case SMS -> {
                String phone = invoice.getCustomerPhone();
                if (phone == null || !PHONE.matcher(phone.trim()).matches()) {
                    throw new FollowUpValidationException("No valid phone number for invoice " + invoice.getId());
                }
                yield phone.trim();
            }
        };
    }
}
