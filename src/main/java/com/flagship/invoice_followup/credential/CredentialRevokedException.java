package com.flagship.invoice_followup.credential;

import lombok.Getter;

import java.util.UUID;

/**
 * The provider no longer accepts this owner's refresh token.
 */
@Getter
public class CredentialRevokedException extends CredentialException {

    private final String reason;

    public CredentialRevokedException(UUID ownerId, String reason) {
        super(ownerId, "Accounting connection for owner " + ownerId + " was revoked, reconnect required");
        this.reason = reason;
    }

    @Override
    public boolean isReconnectRequired() {
        return true;
    }
}
