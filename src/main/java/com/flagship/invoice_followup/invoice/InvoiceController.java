package com.flagship.invoice_followup.invoice;

import com.flagship.invoice_followup.invoice.dto.ExclusionRequest;
import com.flagship.invoice_followup.invoice.dto.InvoiceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final InvoiceService invoiceService;

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getInvoice(id)));
    }

    /**
     * Opts the invoice out of automated reminders, or back in.
     */
    @PutMapping("/{id}/excluded")
    public ResponseEntity<InvoiceResponse> setExcluded(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ExclusionRequest request) {

        log.info("Received exclusion change: invoiceId={}, excluded={}", id, request.getExcluded());
        Invoice updated = invoiceService.setExcluded(id, request.getExcluded());
        return ResponseEntity.ok(InvoiceResponse.from(updated));
    }
}
