package com.flagship.invoice_followup.credential;

import com.flagship.invoice_followup.observability.CorrelationContext;
import com.flagship.invoice_followup.observability.FollowUpMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps owners' access tokens valid by rotating them before they expire.
 *
 * Refresh tokens are single use, so two refreshes racing on the same token would make
 * the loser see invalid_grant for a perfectly healthy connection. Refreshes of one owner
 * are therefore serialized twice: an in-process lock, and a row lock on the credential
 * record that covers other instances. Inside the locks the record is read again, so a
 * refresher that waited behind a winner returns the winner's token instead of calling
 * the provider.
 *
 * When the provider still answers invalid_grant, the stored record is compared with the
 * token that was sent. A different stored token means someone outside these locks rotated
 * it, and that result is returned. Only an unchanged token means the connection is dead.
 */
@Service
@Slf4j
public class CredentialRefresher {

    private final CredentialVault vault;
    private final OAuthTokenClient tokenClient;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final FollowUpMetrics metrics;
    private final Duration refreshMargin;

    // At most one entry per connected owner; dropped once a refresh finds the credential gone.
    private final Map<UUID, ReentrantLock> ownerLocks = new ConcurrentHashMap<>();

    public CredentialRefresher(CredentialVault vault,
                               OAuthTokenClient tokenClient,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               FollowUpMetrics metrics,
                               @Value("${credential.refresh.margin:5m}") Duration refreshMargin) {
        this.vault = vault;
        this.tokenClient = tokenClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.metrics = metrics;
        this.refreshMargin = refreshMargin;
    }

    /**
     * Returns a token pair whose access token is valid for at least the refresh margin,
     * refreshing first if needed.
     *
     * @throws CredentialNotFoundException nothing stored for the owner
     * @throws CredentialInvalidException stored record failed authentication
     * @throws CredentialRevokedException the provider rejected the refresh token
     * @throws CredentialRefreshException transient provider failure, try again later
     */
    public TokenPayload getValidToken(UUID ownerId) {
        TokenPayload current = vault.retrieve(ownerId);
        if (!current.isNearExpiry(clock.instant(), refreshMargin)) {
            return current;
        }
        return refreshUnderLock(ownerId, false);
    }

    /**
     * Rotates the owner's tokens now, even if the access token is still fresh.
     */
    public TokenPayload refresh(UUID ownerId) {
        return refreshUnderLock(ownerId, true);
    }

    /**
     * Rotates only if the token is still near expiry once the lock is held.
     */
    public TokenPayload refreshIfNearExpiry(UUID ownerId) {
        return refreshUnderLock(ownerId, false);
    }

    private TokenPayload refreshUnderLock(UUID ownerId, boolean force) {
        ReentrantLock lock = ownerLocks.computeIfAbsent(ownerId, id -> new ReentrantLock());
        lock.lock();
        MDC.put(CorrelationContext.OWNER_ID_MDC_KEY, ownerId.toString());
        boolean credentialGone = false;
        try {
            // The in-process lock is released only after the row lock's transaction has committed.
            RefreshResult result = transactionTemplate.execute(status -> refreshInTransaction(ownerId, force));
            if (result.revokedReason != null) {
                throw new CredentialRevokedException(ownerId, result.revokedReason);
            }
            return result.token;
        } catch (CredentialNotFoundException e) {
            credentialGone = true;
            throw e;
        } finally {
            MDC.remove(CorrelationContext.OWNER_ID_MDC_KEY);
            lock.unlock();
            if (credentialGone) {
                // a waiter still holding this lock keeps working; the next caller gets a new one
                ownerLocks.remove(ownerId, lock);
            }
        }
    }

    int trackedOwnerCount() {
        return ownerLocks.size();
    }

    private RefreshResult refreshInTransaction(UUID ownerId, boolean force) {
        TokenPayload current = vault.retrieveForUpdate(ownerId);
        Instant now = clock.instant();

        if (!force && !current.isNearExpiry(now, refreshMargin)) {
            log.debug("Token already fresh, skipping provider call: expiresAt={}", current.accessTokenExpiresAt());
            metrics.recordCredentialRefresh("already_fresh");
            return RefreshResult.token(current);
        }

        String sentRefreshToken = current.getRefreshToken();
        try {
            TokenPayload rotated = tokenClient.refresh(sentRefreshToken).completedWith(sentRefreshToken, now);
            vault.store(ownerId, rotated);
            metrics.recordCredentialRefresh("success");
            log.info("Credential refreshed: accessTokenExpiresAt={}", rotated.accessTokenExpiresAt());
            return RefreshResult.token(rotated);

        } catch (InvalidGrantException e) {
            TokenPayload latest = vault.retrieveCommitted(ownerId);
            if (!sentRefreshToken.equals(latest.getRefreshToken())) {
                log.info("invalid_grant after a concurrent rotation, using the rotated token");
                metrics.recordCredentialRefresh("lost_race");
                return RefreshResult.token(latest);
            }

            String reason = "invalid_grant: " + e.getMessage();
            vault.revoke(ownerId, reason);
            metrics.recordCredentialRefresh("revoked");
            return RefreshResult.revoked(reason);

        } catch (OAuthTransportException e) {
            metrics.recordCredentialRefresh("transient_failure");
            log.warn("Credential refresh failed, will retry: {}", e.getMessage());
            throw new CredentialRefreshException(ownerId, "Token refresh failed: " + e.getMessage(), e);
        }
    }

    /**
     * Carries a revocation out of the transaction so it commits before the exception is thrown.
     */
    private static final class RefreshResult {
        final TokenPayload token;
        final String revokedReason;

        private RefreshResult(TokenPayload token, String revokedReason) {
            this.token = token;
            this.revokedReason = revokedReason;
        }

        static RefreshResult token(TokenPayload token) {
            return new RefreshResult(token, null);
        }

        static RefreshResult revoked(String reason) {
            return new RefreshResult(null, reason);
        }
    }
}
