package com.flagship.invoice_followup.credential;

/**
 * Token endpoint unreachable, slow, or answering with something other than a grant decision.
 */
public class OAuthTransportException extends RuntimeException {

    public OAuthTransportException(String message) {
        super(message);
    }

    public OAuthTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
