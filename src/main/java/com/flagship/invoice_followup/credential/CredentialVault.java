package com.flagship.invoice_followup.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_followup.event.CredentialRevokedEvent;
import com.flagship.invoice_followup.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Encrypted storage of OAuth token pairs, one record per owner.
 *
 * Reads fail closed. A caller can always tell apart "nothing stored"
 * ({@link CredentialNotFoundException}), "stored but unusable"
 * ({@link CredentialInvalidException}) and "revoked by the provider"
 * ({@link CredentialRevokedException}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialVault {

    private final CredentialRecordRepository repository;
    private final CredentialCipher cipher;
    private final ObjectMapper objectMapper;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * Encrypts and stores the pair, replacing whatever the owner had. A revoked record
     * becomes active again. A payload without an issue time, as returned by the token
     * endpoint on first link, is stamped with the current time.
     */
    @Transactional
    public void store(UUID ownerId, TokenPayload payload) {
        Instant now = clock.instant();
        TokenPayload stamped = payload.getCreatedAt() == null
            ? payload.toBuilder().createdAt(now).build()
            : payload;
        EncryptedPayload encrypted = cipher.encrypt(serialize(stamped), associatedData(ownerId));
        Instant expiresAt = stamped.accessTokenExpiresAt();

        CredentialRecordEntity entity = repository.findByOwnerId(ownerId)
            .map(existing -> {
                existing.replace(encrypted, expiresAt, now);
                return existing;
            })
            .orElseGet(() -> new CredentialRecordEntity(ownerId, encrypted, expiresAt, now));
        repository.save(entity);

        log.info("Stored credential: ownerId={}, accessTokenExpiresAt={}", ownerId, expiresAt);
    }

    @Transactional(readOnly = true)
    public TokenPayload retrieve(UUID ownerId) {
        return open(repository.findByOwnerId(ownerId)
            .orElseThrow(() -> new CredentialNotFoundException(ownerId)));
    }

    /**
     * Reads and row-locks the owner's record until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TokenPayload retrieveForUpdate(UUID ownerId) {
        return open(repository.findByOwnerIdForUpdate(ownerId)
            .orElseThrow(() -> new CredentialNotFoundException(ownerId)));
    }

    /**
     * Reads the latest committed record in a separate transaction, bypassing anything the
     * caller's persistence context has cached.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public TokenPayload retrieveCommitted(UUID ownerId) {
        return retrieve(ownerId);
    }

    /**
     * Marks the owner's record revoked and emits CredentialRevoked. No-op if already revoked.
     */
    @Transactional
    public void revoke(UUID ownerId, String reason) {
        CredentialRecordEntity entity = repository.findByOwnerId(ownerId)
            .orElseThrow(() -> new CredentialNotFoundException(ownerId));
        if (entity.isRevoked()) {
            return;
        }
        Instant now = clock.instant();
        entity.revoke(reason, now);
        repository.save(entity);
        outboxService.saveEvent(CredentialRevokedEvent.of(ownerId, reason, now));

        log.warn("Credential revoked: ownerId={}, reason={}", ownerId, reason);
    }

    @Transactional
    public boolean delete(UUID ownerId) {
        boolean deleted = repository.deleteByOwnerId(ownerId) > 0;
        if (deleted) {
            log.info("Deleted credential: ownerId={}", ownerId);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public CredentialStatusView status(UUID ownerId) {
        return repository.findByOwnerId(ownerId)
            .map(CredentialStatusView::from)
            .orElseThrow(() -> new CredentialNotFoundException(ownerId));
    }

    @Transactional(readOnly = true)
    public List<UUID> ownersExpiringBefore(Instant threshold) {
        return repository.findActiveOwnersExpiringBefore(threshold);
    }

    private TokenPayload open(CredentialRecordEntity entity) {
        UUID ownerId = entity.getOwnerId();
        if (entity.isRevoked()) {
            throw new CredentialRevokedException(ownerId, entity.getRevocationReason());
        }

        byte[] plaintext;
        try {
            plaintext = cipher.decrypt(entity.encryptedPayload(), associatedData(ownerId));
        } catch (GeneralSecurityException e) {
            log.error("Credential failed authentication: ownerId={}, error={}", ownerId, e.getMessage());
            throw new CredentialInvalidException(ownerId, "Stored credential failed authentication", e);
        }

        try {
            return objectMapper.readValue(plaintext, TokenPayload.class);
        } catch (IOException e) {
            log.error("Credential payload undecodable: ownerId={}", ownerId);
            throw new CredentialInvalidException(ownerId, "Stored credential payload is undecodable", e);
        }
    }

    private byte[] serialize(TokenPayload payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize token payload", e);
        }
    }

    private static byte[] associatedData(UUID ownerId) {
        return ownerId.toString().getBytes(StandardCharsets.UTF_8);
    }
}
