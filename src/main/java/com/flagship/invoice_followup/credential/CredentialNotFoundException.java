package com.flagship.invoice_followup.credential;

import java.util.UUID;

public class CredentialNotFoundException extends CredentialException {

    public CredentialNotFoundException(UUID ownerId) {
        super(ownerId, "No credential stored for owner " + ownerId);
    }

    @Override
    public boolean isReconnectRequired() {
        return true;
    }
}
