package com.flagship.invoice_followup.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Operator view of credential records. Token values never leave the service.
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
@Slf4j
public class CredentialController {

    private final CredentialVault vault;
    private final CredentialRefresher refresher;

    @GetMapping("/{ownerId}")
    public ResponseEntity<CredentialStatusView> status(@PathVariable("ownerId") UUID ownerId) {
        return ResponseEntity.ok(vault.status(ownerId));
    }

    /**
     * Forces a rotation now. Useful after a provider incident.
     */
    @PostMapping("/{ownerId}/refresh")
    public ResponseEntity<CredentialStatusView> refresh(@PathVariable("ownerId") UUID ownerId) {
        refresher.refresh(ownerId);
        return ResponseEntity.ok(vault.status(ownerId));
    }

    /**
     * Manual revocation. The record stays, marked REVOKED, until the owner reconnects.
     */
    @DeleteMapping("/{ownerId}")
    public ResponseEntity<CredentialStatusView> revoke(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "reason", defaultValue = "revoked by operator") String reason) {
        log.info("Manual credential revocation: ownerId={}", ownerId);
        vault.revoke(ownerId, reason);
        return ResponseEntity.ok(vault.status(ownerId));
    }
}
