package com.flagship.invoice_followup.credential;

/**
 * Client for the accounting system's OAuth token endpoint.
 */
public interface OAuthTokenClient {

    /**
     * Exchanges a refresh token for a new token pair.
     *
     * @throws InvalidGrantException when the provider rejects the refresh token
     * @throws OAuthTransportException on any other failure
     */
    TokenPayload refresh(String refreshToken);
}
