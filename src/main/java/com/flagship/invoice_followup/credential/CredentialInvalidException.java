package com.flagship.invoice_followup.credential;

import java.util.UUID;

/**
 * The stored record cannot be trusted: authentication failed, or IV, tag or payload is
 * malformed. Never retried.
 */
public class CredentialInvalidException extends CredentialException {

    public CredentialInvalidException(UUID ownerId, String message, Throwable cause) {
        super(ownerId, message, cause);
    }

    @Override
    public boolean isReconnectRequired() {
        return true;
    }
}
