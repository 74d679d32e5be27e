package com.flagship.invoice_followup.credential;

import com.flagship.invoice_followup.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Periodically refreshes every active credential whose access token expires within the
 * margin. Owners are processed one at a time and no lock spans the sweep.
 */
@Component
@ConditionalOnProperty(name = "credential.refresh.sweep.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class CredentialRefreshSweep {

    private final CredentialVault vault;
    private final CredentialRefresher refresher;
    private final Clock clock;
    private final Duration refreshMargin;

    public CredentialRefreshSweep(CredentialVault vault,
                                  CredentialRefresher refresher,
                                  Clock clock,
                                  @Value("${credential.refresh.margin:5m}") Duration refreshMargin) {
        this.vault = vault;
        this.refresher = refresher;
        this.clock = clock;
        this.refreshMargin = refreshMargin;
    }

    @Scheduled(fixedDelayString = "${credential.refresh.sweep-interval-ms:600000}",
               initialDelayString = "${credential.refresh.sweep-initial-delay-ms:60000}")
    public void scheduledSweep() {
        CorrelationContext.begin("sweep");
        try {
            sweep(clock.instant());
        } catch (Exception e) {
            log.error("Credential sweep failed: {}", e.getMessage(), e);
        } finally {
            CorrelationContext.clear();
        }
    }

    /**
     * @return number of owners whose refresh ended with a usable token
     */
    public int sweep(Instant now) {
        List<UUID> owners = vault.ownersExpiringBefore(now.plus(refreshMargin));
        if (owners.isEmpty()) {
            return 0;
        }

        int refreshed = 0;
        for (UUID ownerId : owners) {
            try {
                refresher.refreshIfNearExpiry(ownerId);
                refreshed++;
            } catch (CredentialRevokedException e) {
                log.warn("Owner needs to reconnect: ownerId={}", ownerId);
            } catch (CredentialException e) {
                log.warn("Sweep could not refresh owner: ownerId={}, error={}", ownerId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error refreshing owner: ownerId={}", ownerId, e);
            }
        }

        log.info("Credential sweep complete: candidates={}, refreshed={}", owners.size(), refreshed);
        return refreshed;
    }
}
