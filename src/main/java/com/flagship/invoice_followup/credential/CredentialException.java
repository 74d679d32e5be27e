package com.flagship.invoice_followup.credential;

import lombok.Getter;

import java.util.UUID;

/**
 * Base type for credential failures callers must tell apart.
 */
@Getter
public abstract class CredentialException extends RuntimeException {

    private final UUID ownerId;

    protected CredentialException(UUID ownerId, String message) {
        super(message);
        this.ownerId = ownerId;
    }

    protected CredentialException(UUID ownerId, String message, Throwable cause) {
        super(message, cause);
        this.ownerId = ownerId;
    }

    /**
     * True when only the user re-linking the accounting system can fix this.
     */
    public abstract boolean isReconnectRequired();
}
