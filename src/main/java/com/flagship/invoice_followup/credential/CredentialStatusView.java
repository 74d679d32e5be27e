package com.flagship.invoice_followup.credential;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Credential metadata safe to show to an operator. Never carries token material.
 */
@Value
public class CredentialStatusView {

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("status")
    CredentialStatus status;

    @JsonProperty("access_token_expires_at")
    Instant accessTokenExpiresAt;

    @JsonProperty("revoked_at")
    Instant revokedAt;

    @JsonProperty("revocation_reason")
    String revocationReason;

    @JsonProperty("updated_at")
    Instant updatedAt;

    static CredentialStatusView from(CredentialRecordEntity entity) {
        return new CredentialStatusView(
            entity.getOwnerId(),
            entity.getStatus(),
            entity.getAccessTokenExpiresAt(),
            entity.getRevokedAt(),
            entity.getRevocationReason(),
            entity.getUpdatedAt()
        );
    }
}
