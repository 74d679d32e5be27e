package com.flagship.invoice_followup.credential;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * These tests verify that:
 * - The sweep asks the vault for owners expiring within the margin
 * - One owner's failure does not stop the others
 */
class CredentialRefreshSweepTest {

    private static final Instant NOW = Instant.parse("2025-01-09T09:00:00Z");

    private CredentialVault vault;
    private CredentialRefresher refresher;
    private CredentialRefreshSweep sweep;

    @BeforeEach
    void setUp() {
        vault = mock(CredentialVault.class);
        refresher = mock(CredentialRefresher.class);
        sweep = new CredentialRefreshSweep(vault, refresher, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Nothing expiring means no provider calls")
    void testSweep_NothingDue() {
        when(vault.ownersExpiringBefore(NOW.plus(Duration.ofMinutes(5)))).thenReturn(List.of());

        assertEquals(0, sweep.sweep(NOW));
        verifyNoInteractions(refresher);
    }

    @Test
    @DisplayName("Revoked, unavailable and broken owners are skipped; the rest are refreshed")
    void testSweep_ContinuesPastFailures() {
        UUID revoked = UUID.randomUUID();
        UUID unavailable = UUID.randomUUID();
        UUID broken = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        when(vault.ownersExpiringBefore(NOW.plus(Duration.ofMinutes(5))))
            .thenReturn(List.of(revoked, unavailable, broken, healthy));
        when(refresher.refreshIfNearExpiry(revoked)).thenThrow(new CredentialRevokedException(revoked, "invalid_grant"));
        when(refresher.refreshIfNearExpiry(unavailable))
            .thenThrow(new CredentialRefreshException(unavailable, "Token refresh failed", null));
        when(refresher.refreshIfNearExpiry(broken)).thenThrow(new IllegalStateException("boom"));
        when(refresher.refreshIfNearExpiry(healthy)).thenReturn(TokenPayload.builder().accessToken("access-2").refreshToken("refresh-2").build());

        assertEquals(1, sweep.sweep(NOW));
        verify(refresher).refreshIfNearExpiry(healthy);
        verify(refresher, times(4)).refreshIfNearExpiry(any(UUID.class));
    }
}
