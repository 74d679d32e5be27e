package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.channel.DeliveryResult;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of follow-up attempts and the single source of truth for dedup.
 *
 * Every mutating call is one conditional write. Callers learn whether they won from the
 * return value; none of these methods throw on a lost race.
 */
public interface FollowUpLedger {

    Optional<FollowUp> find(UUID invoiceId, UUID templateId);

    List<FollowUp> findByInvoices(Collection<UUID> invoiceIds);

    List<FollowUp> history(UUID invoiceId);

    /**
     * Takes exclusive ownership of the candidate's next attempt.
     *
     * A first attempt inserts the row and loses if it already exists. A retry re-claims
     * the existing row only if it still carries {@code observedAttempt} and is either
     * FAILED or a PENDING claim older than {@code staleBefore}.
     *
     * @return the claimed row, or empty if another worker got there first
     */
    Optional<FollowUp> claim(FollowUpCandidate candidate, Instant now, Instant staleBefore);

    /**
     * Records a successful send, stamps the invoice's last follow-up time and emits
     * FollowUpSent, atomically.
     *
     * @return false if the claim was superseded and nothing was written
     */
    boolean markSent(FollowUp claimed, DeliveryResult result, String messageContent, Instant now);

    /**
     * Records a failed attempt and emits FollowUpFailed, atomically.
     *
     * @return false if the claim was superseded and nothing was written
     */
    boolean markFailed(FollowUp claimed, FailureKind kind, String errorMessage,
                       String messageContent, Instant now);

    /**
     * Moves a SENT row to DELIVERED. Idempotent: a repeated receipt changes nothing.
     *
     * @return true if the row changed
     */
    boolean markDelivered(String providerMessageId, Instant deliveredAt);
}
