package com.flagship.invoice_followup.credential;

import com.flagship.invoice_followup.config.JacksonConfig;
import com.flagship.invoice_followup.followup.FollowUpRepository;
import com.flagship.invoice_followup.observability.FollowUpMetrics;
import com.flagship.invoice_followup.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Token rotation under concurrency.
 *
 * The fake provider treats refresh tokens as single use, like the real one: presenting
 * any token other than the current one is answered with invalid_grant.
 */
class CredentialRefresherTest {

    private static final Instant NOW = Instant.parse("2025-01-09T09:00:00Z");

    private CredentialVault vault;
    private FakeTokenEndpoint endpoint;
    private CredentialRefresher refresher;
    private final UUID owner = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        InMemoryCredentialRecords records = new InMemoryCredentialRecords();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        vault = new CredentialVault(records.repository(), new CredentialCipher("refresher-test-secret"),
            new JacksonConfig().objectMapper(), mock(OutboxService.class), clock);
        endpoint = new FakeTokenEndpoint("refresh-1");
        FollowUpMetrics metrics = new FollowUpMetrics(new SimpleMeterRegistry(), mock(FollowUpRepository.class));
        refresher = new CredentialRefresher(vault, endpoint, mock(PlatformTransactionManager.class),
            clock, metrics, Duration.ofMinutes(5));
    }

    private void storeExpiringIn(Duration remaining) {
        vault.store(owner, CredentialVaultTest.tokens("access-1", "refresh-1",
            NOW.minusSeconds(3600).plus(remaining)));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("Refresh decisions")
    class RefreshDecisions {

        @Test
        @DisplayName("Fresh token is returned without calling the provider")
        void testFreshToken_NoCall() {
            printTestHeader("Fresh Token");
            storeExpiringIn(Duration.ofMinutes(30));

            assertEquals("access-1", refresher.getValidToken(owner).getAccessToken());
            assertEquals(0, endpoint.calls.get());

            printSuccess("No provider call for a fresh token");
        }

        @Test
        @DisplayName("Token inside the margin is rotated and persisted")
        void testNearExpiry_Rotates() {
            printTestHeader("Near Expiry");
            storeExpiringIn(Duration.ofMinutes(2));

            TokenPayload rotated = refresher.getValidToken(owner);

            assertEquals("access-2", rotated.getAccessToken());
            assertEquals("refresh-2", rotated.getRefreshToken());
            assertEquals(NOW.plusSeconds(3600), rotated.accessTokenExpiresAt());
            assertEquals("refresh-2", vault.retrieve(owner).getRefreshToken());

            printSuccess("Rotated pair stored");
        }

        @Test
        @DisplayName("Forced refresh rotates a fresh token")
        void testForcedRefresh() {
            printTestHeader("Forced Refresh");
            storeExpiringIn(Duration.ofMinutes(30));

            assertEquals("access-2", refresher.refresh(owner).getAccessToken());
            assertEquals(1, endpoint.calls.get());

            printSuccess("Forced refresh called the provider");
        }

        @Test
        @DisplayName("Provider that does not rotate keeps the previous refresh token")
        void testNonRotatingProvider() {
            printTestHeader("Non-rotating Provider");
            storeExpiringIn(Duration.ofMinutes(1));
            endpoint.rotateRefreshToken = false;

            assertEquals("refresh-1", refresher.getValidToken(owner).getRefreshToken());

            printSuccess("Refresh token carried over");
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent refreshers call the provider once and all get the new token")
        void testConcurrentRefreshers_SingleProviderCall() throws Exception {
            printTestHeader("Concurrent Refreshers");
            storeExpiringIn(Duration.ofMinutes(1));
            endpoint.latency = Duration.ofMillis(50);

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TokenPayload>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return refresher.getValidToken(owner);
                }));
            }
            start.countDown();

            for (Future<TokenPayload> result : results) {
                assertEquals("access-2", result.get(5, TimeUnit.SECONDS).getAccessToken());
            }
            executor.shutdownNow();

            System.out.println("Provider calls: " + endpoint.calls.get());
            assertEquals(1, endpoint.calls.get(), "Waiters must reuse the winner's token");
            assertEquals(CredentialStatus.ACTIVE, vault.status(owner).getStatus());

            printSuccess("One rotation served all " + threads + " callers");
        }

        @Test
        @DisplayName("invalid_grant after an outside rotation returns the rotated token")
        void testInvalidGrantAfterOutsideRotation_NotRevoked() {
            printTestHeader("Lost Race");
            storeExpiringIn(Duration.ofMinutes(1));
            endpoint.beforeAnswer = () -> {
                // another instance rotated between our read and our call
                endpoint.current = "refresh-other";
                vault.store(owner, CredentialVaultTest.tokens("access-other", "refresh-other", NOW));
            };

            TokenPayload result = refresher.getValidToken(owner);

            assertEquals("access-other", result.getAccessToken());
            assertEquals(CredentialStatus.ACTIVE, vault.status(owner).getStatus());

            printSuccess("Race was not mistaken for revocation");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("invalid_grant for the current token revokes the credential")
        void testInvalidGrant_Revokes() {
            printTestHeader("Revocation");
            storeExpiringIn(Duration.ofMinutes(1));
            endpoint.current = "revoked-by-user";

            CredentialRevokedException e =
                assertThrows(CredentialRevokedException.class, () -> refresher.getValidToken(owner));

            assertTrue(e.isReconnectRequired());
            assertEquals(CredentialStatus.REVOKED, vault.status(owner).getStatus());
            assertThrows(CredentialRevokedException.class, () -> refresher.getValidToken(owner));

            printSuccess("Credential revoked and reads fail closed");
        }

        @Test
        @DisplayName("Transport failure is transient and leaves the credential untouched")
        void testTransportFailure_Transient() {
            printTestHeader("Transport Failure");
            storeExpiringIn(Duration.ofMinutes(1));
            endpoint.down = true;

            CredentialRefreshException e =
                assertThrows(CredentialRefreshException.class, () -> refresher.getValidToken(owner));

            assertFalse(e.isReconnectRequired());
            assertEquals(CredentialStatus.ACTIVE, vault.status(owner).getStatus());
            assertEquals("refresh-1", vault.retrieve(owner).getRefreshToken());

            endpoint.down = false;
            assertEquals("access-2", refresher.getValidToken(owner).getAccessToken());

            printSuccess("Later refresh succeeds");
        }

        @Test
        @DisplayName("Missing credential is reported as not found")
        void testMissingCredential() {
            assertThrows(CredentialNotFoundException.class, () -> refresher.getValidToken(owner));
            assertEquals(0, endpoint.calls.get());
        }

        @Test
        @DisplayName("Per-owner lock is dropped once the credential is gone")
        void testLockDroppedAfterDisconnect() {
            printTestHeader("Lock Dropped After Disconnect");
            storeExpiringIn(Duration.ofMinutes(30));
            refresher.refresh(owner);
            assertEquals(1, refresher.trackedOwnerCount());

            vault.delete(owner);

            assertThrows(CredentialNotFoundException.class, () -> refresher.refresh(owner));
            assertEquals(0, refresher.trackedOwnerCount());

            printSuccess("No lock kept for a disconnected owner");
        }
    }

    /**
     * Token endpoint with single-use refresh tokens.
     */
    static class FakeTokenEndpoint implements OAuthTokenClient {
        final AtomicInteger calls = new AtomicInteger();
        volatile String current;
        volatile boolean rotateRefreshToken = true;
        volatile boolean down;
        volatile Duration latency = Duration.ZERO;
        volatile Runnable beforeAnswer = () -> { };
        private int generation = 1;

        FakeTokenEndpoint(String initialRefreshToken) {
            this.current = initialRefreshToken;
        }

        @Override
        public synchronized TokenPayload refresh(String refreshToken) {
            int call = calls.incrementAndGet();
            if (down) {
                throw new OAuthTransportException("connect timed out");
            }
            sleep();
            beforeAnswer.run();
            if (!refreshToken.equals(current)) {
                throw new InvalidGrantException("Incorrect or invalid refresh token");
            }
            generation++;
            String nextRefresh = rotateRefreshToken ? "refresh-" + generation : null;
            if (nextRefresh != null) {
                current = nextRefresh;
            }
            System.out.println("Provider call #" + call + " rotated to generation " + generation);
            return TokenPayload.builder()
                .accessToken("access-" + generation)
                .refreshToken(nextRefresh)
                .tokenType("bearer")
                .expiresIn(3600)
                .build();
        }

        private void sleep() {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
