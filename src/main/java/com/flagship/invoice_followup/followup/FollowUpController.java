package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.followup.dto.FollowUpResponse;
import com.flagship.invoice_followup.followup.dto.SendNowRequest;
import com.flagship.invoice_followup.followup.dto.SendNowResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Admin endpoints over the follow-up ledger.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class FollowUpController {

    private final DispatchWorker dispatchWorker;
    private final FollowUpLedger ledger;
    private final FollowUpService followUpService;

    /**
     * Sends one reminder now. Returns 200 when sent, 409 when another worker holds the
     * claim, 422 when the attempt failed (the ledger row says why).
     */
    @PostMapping("/follow-ups/send-now")
    public ResponseEntity<SendNowResponse> sendNow(@Valid @RequestBody SendNowRequest request) {
        DispatchOutcome outcome = dispatchWorker.sendNow(request.getInvoiceId(), request.getTemplateId());
        FollowUpResponse row = ledger.find(request.getInvoiceId(), request.getTemplateId())
            .map(FollowUpResponse::from)
            .orElse(null);

        HttpStatus status = switch (outcome) {
            case SENT -> HttpStatus.OK;
            case CLAIM_CONFLICT, SUPERSEDED -> HttpStatus.CONFLICT;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return ResponseEntity.status(status).body(new SendNowResponse(outcome, row));
    }

    @GetMapping("/invoices/{id}/follow-ups")
    public ResponseEntity<List<FollowUpResponse>> history(@PathVariable("id") UUID invoiceId) {
        return ResponseEntity.ok(followUpService.historyFor(invoiceId).stream()
            .map(FollowUpResponse::from)
            .toList());
    }

    @GetMapping("/follow-ups/{id}")
    public ResponseEntity<FollowUpResponse> getFollowUp(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(FollowUpResponse.from(followUpService.getFollowUp(id)));
    }

    @GetMapping("/follow-ups/stats")
    public ResponseEntity<DeliveryStats> stats(@RequestParam(name = "days", defaultValue = "7") int days) {
        return ResponseEntity.ok(followUpService.stats(days));
    }
}
