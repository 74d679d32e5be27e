package com.flagship.invoice_followup.invoice;

import com.flagship.invoice_followup.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * User-facing invoice operations. The importer writes invoices directly; this service
 * only covers what an operator may change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    /**
     * Opts an invoice out of (or back into) automated follow-ups.
     * Takes effect at the next scan; a send already claimed is not interrupted.
     */
    @Transactional
    public Invoice setExcluded(UUID invoiceId, boolean excluded) {
        InvoiceEntity entity = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));

        if (entity.isExcluded() != excluded) {
            entity.setExcluded(excluded);
            invoiceRepository.save(entity);
            log.info("Invoice follow-up exclusion changed: invoiceId={}, excluded={}", invoiceId, excluded);
        }
        return entity.toDomain();
    }
}
