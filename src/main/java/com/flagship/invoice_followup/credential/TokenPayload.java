package com.flagship.invoice_followup.credential;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth token pair for one owner's accounting-system connection.
 *
 * Serialized with the provider's field names, so a token endpoint response can be read
 * into it directly. Token values are excluded from {@code toString}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenPayload {

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    @ToString.Exclude
    @JsonProperty("access_token")
    String accessToken;

    @ToString.Exclude
    @JsonProperty("refresh_token")
    String refreshToken;

    @JsonProperty("token_type")
    String tokenType;

    /** Access token lifetime in seconds, counted from {@code createdAt}. */
    @JsonProperty("expires_in")
    long expiresIn;

    @JsonProperty("x_refresh_token_expires_in")
    Long refreshTokenExpiresIn;

    @JsonProperty("scope")
    String scope;

    /** Accounting-system company identifier the tokens are bound to. */
    @JsonProperty("realm_id")
    String realmId;

    @JsonProperty("created_at")
    Instant createdAt;

    /**
     * When the access token stops working. A missing or non-positive lifetime counts as one hour.
     */
    public Instant accessTokenExpiresAt() {
        long lifetime = expiresIn > 0 ? expiresIn : DEFAULT_EXPIRES_IN_SECONDS;
        return createdAt.plusSeconds(lifetime);
    }

    public boolean isNearExpiry(Instant now, Duration margin) {
        return !accessTokenExpiresAt().isAfter(now.plus(margin));
    }

    /**
     * Fills in what a token endpoint response may leave out: the issue time, and the
     * refresh token for providers that do not rotate it.
     */
    public TokenPayload completedWith(String previousRefreshToken, Instant issuedAt) {
        TokenPayloadBuilder builder = toBuilder();
        if (createdAt == null) {
            builder.createdAt(issuedAt);
        }
        if (refreshToken == null || refreshToken.isBlank()) {
            builder.refreshToken(previousRefreshToken);
        }
        return builder.build();
    }
}
