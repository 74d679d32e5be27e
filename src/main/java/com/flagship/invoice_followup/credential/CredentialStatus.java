package com.flagship.invoice_followup.credential;

public enum CredentialStatus {
    ACTIVE,
    /** The provider rejected the refresh token. Only a new connection by the user recovers. */
    REVOKED
}
