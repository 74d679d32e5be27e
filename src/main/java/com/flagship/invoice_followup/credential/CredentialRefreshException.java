package com.flagship.invoice_followup.credential;

import java.util.UUID;

/**
 * Refresh could not complete for a reason that may go away: network error, provider
 * 5xx, timeout. The stored record is left as it was.
 */
public class CredentialRefreshException extends CredentialException {

    public CredentialRefreshException(UUID ownerId, String message, Throwable cause) {
        super(ownerId, message, cause);
    }

    @Override
    public boolean isReconnectRequired() {
        return false;
    }
}
