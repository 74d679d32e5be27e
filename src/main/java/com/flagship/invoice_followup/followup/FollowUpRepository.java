package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.template.Channel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the ledger. Writes live in {@link JdbcFollowUpLedger}.
 */
@Repository
public interface FollowUpRepository extends JpaRepository<FollowUpEntity, UUID> {

    List<FollowUpEntity> findByInvoiceIdOrderByScheduledAtAsc(UUID invoiceId);

    List<FollowUpEntity> findByInvoiceIdIn(Collection<UUID> invoiceIds);

    Optional<FollowUpEntity> findByInvoiceIdAndTemplateId(UUID invoiceId, UUID templateId);

    Optional<FollowUpEntity> findByProviderMessageId(String providerMessageId);

    long countByStatus(FollowUpStatus status);

    /**
     * Moves FAILED rows whose last failure is older than {@code before} to ARCHIVED.
     * SENT and DELIVERED rows are kept as they are: they block re-sends.
     */
    @Modifying
    @Query(value = """
        UPDATE follow_ups
        SET status = 'ARCHIVED', updated_at = :now
        WHERE status = 'FAILED' AND failed_at < :before
        """, nativeQuery = true)
    int archiveFailedBefore(@Param("before") Instant before, @Param("now") Instant now);

    /**
     * Row counts per (status, channel) for rows touched since {@code since}.
     */
    @Query("""
        SELECT f.status AS status, f.channel AS channel, COUNT(f) AS total
        FROM FollowUpEntity f
        WHERE f.updatedAt >= :since
        GROUP BY f.status, f.channel
        """)
    List<StatusChannelCount> countByStatusAndChannelSince(@Param("since") Instant since);

    interface StatusChannelCount {
        FollowUpStatus getStatus();
        Channel getChannel();
        long getTotal();
    }
}
