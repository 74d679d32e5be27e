package com.flagship.invoice_followup.credential;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Encrypted token pair of one owner. One row per owner, replaced wholesale on each write.
 *
 * {@code accessTokenExpiresAt} is kept in clear so the refresh sweep can find records
 * nearing expiry without decrypting every row.
 */
@Entity
@Table(name = "credential_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CredentialRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, unique = true, updatable = false)
    private UUID ownerId;

    @Column(nullable = false, columnDefinition = "bytea")
    private byte[] ciphertext;

    @Column(nullable = false, columnDefinition = "bytea")
    private byte[] iv;

    @Column(name = "auth_tag", nullable = false, columnDefinition = "bytea")
    private byte[] authTag;

    @Column(name = "access_token_expires_at", nullable = false)
    private Instant accessTokenExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CredentialStatus status;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revocation_reason", columnDefinition = "TEXT")
    private String revocationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CredentialRecordEntity(UUID ownerId, EncryptedPayload payload, Instant accessTokenExpiresAt, Instant now) {
        this.id = UUID.randomUUID();
        this.ownerId = ownerId;
        this.createdAt = now;
        replace(payload, accessTokenExpiresAt, now);
    }

    /**
     * Overwrites the stored pair. A replaced record is always ACTIVE again.
     */
    public void replace(EncryptedPayload payload, Instant accessTokenExpiresAt, Instant now) {
        this.ciphertext = payload.getCiphertext();
        this.iv = payload.getIv();
        this.authTag = payload.getAuthTag();
        this.accessTokenExpiresAt = accessTokenExpiresAt;
        this.status = CredentialStatus.ACTIVE;
        this.revokedAt = null;
        this.revocationReason = null;
        this.updatedAt = now;
    }

    public void revoke(String reason, Instant now) {
        this.status = CredentialStatus.REVOKED;
        this.revokedAt = now;
        this.revocationReason = reason;
        this.updatedAt = now;
    }

    public boolean isRevoked() {
        return status == CredentialStatus.REVOKED;
    }

    public EncryptedPayload encryptedPayload() {
        return new EncryptedPayload(ciphertext, iv, authTag);
    }
}
