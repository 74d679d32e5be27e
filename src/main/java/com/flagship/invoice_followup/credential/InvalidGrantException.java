package com.flagship.invoice_followup.credential;

/**
 * Token endpoint answered {@code invalid_grant}: the refresh token sent is expired,
 * revoked or already used.
 */
public class InvalidGrantException extends RuntimeException {

    public InvalidGrantException(String message) {
        super(message);
    }
}
