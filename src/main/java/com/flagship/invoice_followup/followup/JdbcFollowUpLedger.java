package com.flagship.invoice_followup.followup;

import com.flagship.invoice_followup.channel.DeliveryResult;
import com.flagship.invoice_followup.event.FollowUpFailedEvent;
import com.flagship.invoice_followup.event.FollowUpSentEvent;
import com.flagship.invoice_followup.outbox.OutboxService;
import com.flagship.invoice_followup.template.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL ledger on plain JDBC.
 *
 * Claims and outcome writes are single statements whose WHERE clause carries the whole
 * precondition, so the database arbitrates every race:
 * - first claim: INSERT ... ON CONFLICT (invoice_id, template_id) DO NOTHING
 * - re-claim: UPDATE guarded by the observed attempt_count and a claimable status
 * - outcome: UPDATE guarded by the claimed attempt_count and status = 'PENDING'
 */
@Repository
@Slf4j
public class JdbcFollowUpLedger implements FollowUpLedger {

    private static final String SELECT_COLUMNS = """
        SELECT id, invoice_id, template_id, channel, scheduled_at, status, attempt_count,
               claimed_at, sent_at, delivered_at, failed_at, failure_kind, error_message,
               message_content, provider_message_id, response_data, created_at, updated_at
        FROM follow_ups
        """;

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;

    public JdbcFollowUpLedger(JdbcTemplate jdbcTemplate, OutboxService outboxService) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FollowUp> find(UUID invoiceId, UUID templateId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE invoice_id = ? AND template_id = ?",
            followUpRowMapper(),
            invoiceId, templateId
        ).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FollowUp> findByInvoices(Collection<UUID> invoiceIds) {
        if (invoiceIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE invoice_id = ANY (?)",
            ps -> ps.setArray(1, ps.getConnection().createArrayOf("uuid", invoiceIds.toArray())),
            followUpRowMapper()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<FollowUp> history(UUID invoiceId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE invoice_id = ? ORDER BY scheduled_at ASC",
            followUpRowMapper(),
            invoiceId
        );
    }

    @Override
    @Transactional
    public Optional<FollowUp> claim(FollowUpCandidate candidate, Instant now, Instant staleBefore) {
        return candidate.isFirstAttempt()
            ? claimFirst(candidate, now)
            : reclaim(candidate, now, staleBefore);
    }

    private Optional<FollowUp> claimFirst(FollowUpCandidate candidate, Instant now) {
        UUID id = UUID.randomUUID();
        UUID invoiceId = candidate.getInvoice().getId();
        UUID templateId = candidate.getTemplate().getId();
        Channel channel = candidate.getTemplate().getChannel();

        int inserted = jdbcTemplate.update("""
            INSERT INTO follow_ups (id, invoice_id, template_id, channel, scheduled_at, status,
                                    attempt_count, claimed_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, 'PENDING', 1, ?, ?, ?)
            ON CONFLICT (invoice_id, template_id) DO NOTHING
            """,
            id, invoiceId, templateId, channel.name(),
            ts(candidate.getScheduledAt()), ts(now), ts(now), ts(now)
        );

        if (inserted == 0) {
            return Optional.empty();
        }
        return Optional.of(FollowUp.claimedFirst(id, invoiceId, templateId, channel,
            candidate.getScheduledAt(), now));
    }

    private Optional<FollowUp> reclaim(FollowUpCandidate candidate, Instant now, Instant staleBefore) {
        int updated = jdbcTemplate.update("""
            UPDATE follow_ups
            SET status = 'PENDING', attempt_count = attempt_count + 1, claimed_at = ?,
                failed_at = NULL, failure_kind = NULL, error_message = NULL, updated_at = ?
            WHERE id = ?
            AND attempt_count = ?
            AND (status = 'FAILED' OR (status = 'PENDING' AND claimed_at <= ?))
            """,
            ts(now), ts(now), candidate.getExistingFollowUpId(),
            candidate.getObservedAttempt(), ts(staleBefore)
        );

        if (updated == 0) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = ?",
            followUpRowMapper(),
            candidate.getExistingFollowUpId()
        ).stream().findFirst();
    }

    @Override
    @Transactional
    public boolean markSent(FollowUp claimed, DeliveryResult result, String messageContent, Instant now) {
        int updated = jdbcTemplate.update("""
            UPDATE follow_ups
            SET status = 'SENT', sent_at = ?, provider_message_id = ?, response_data = ?,
                message_content = ?, updated_at = ?
            WHERE id = ? AND attempt_count = ? AND status = 'PENDING'
            """,
            ts(now), result.getProviderMessageId(), result.getResponseData(),
            messageContent, ts(now),
            claimed.getId(), claimed.getAttemptCount()
        );
        if (updated == 0) {
            return false;
        }

        jdbcTemplate.update(
            "UPDATE invoices SET last_followup_at = ?, updated_at = ? WHERE id = ?",
            ts(now), ts(now), claimed.getInvoiceId()
        );

        FollowUp sent = claimed.sent(result.getProviderMessageId(), result.getResponseData(), messageContent, now);
        outboxService.saveEvent(FollowUpSentEvent.from(sent));
        return true;
    }

    @Override
    @Transactional
    public boolean markFailed(FollowUp claimed, FailureKind kind, String errorMessage,
                              String messageContent, Instant now) {
        int updated = jdbcTemplate.update("""
            UPDATE follow_ups
            SET status = 'FAILED', failed_at = ?, failure_kind = ?, error_message = ?,
                message_content = COALESCE(CAST(? AS TEXT), message_content), updated_at = ?
            WHERE id = ? AND attempt_count = ? AND status = 'PENDING'
            """,
            ts(now), kind.name(), errorMessage, messageContent, ts(now),
            claimed.getId(), claimed.getAttemptCount()
        );
        if (updated == 0) {
            return false;
        }

        FollowUp failed = claimed.failed(kind, errorMessage, messageContent, now);
        outboxService.saveEvent(FollowUpFailedEvent.from(failed, kind == FailureKind.TRANSIENT));
        return true;
    }

    @Override
    @Transactional
    public boolean markDelivered(String providerMessageId, Instant deliveredAt) {
        int updated = jdbcTemplate.update("""
            UPDATE follow_ups
            SET status = 'DELIVERED', delivered_at = ?, updated_at = ?
            WHERE provider_message_id = ? AND status = 'SENT'
            """,
            ts(deliveredAt), ts(deliveredAt), providerMessageId
        );
        return updated > 0;
    }

    private RowMapper<FollowUp> followUpRowMapper() {
        return (rs, rowNum) -> FollowUp.builder()
            .id(rs.getObject("id", UUID.class))
            .invoiceId(rs.getObject("invoice_id", UUID.class))
            .templateId(rs.getObject("template_id", UUID.class))
            .channel(Channel.valueOf(rs.getString("channel")))
            .scheduledAt(instant(rs, "scheduled_at"))
            .status(FollowUpStatus.valueOf(rs.getString("status")))
            .attemptCount(rs.getInt("attempt_count"))
            .claimedAt(instant(rs, "claimed_at"))
            .sentAt(instant(rs, "sent_at"))
            .deliveredAt(instant(rs, "delivered_at"))
            .failedAt(instant(rs, "failed_at"))
            .failureKind(rs.getString("failure_kind") == null ? null : FailureKind.valueOf(rs.getString("failure_kind")))
            .errorMessage(rs.getString("error_message"))
            .messageContent(rs.getString("message_content"))
            .providerMessageId(rs.getString("provider_message_id"))
            .responseData(rs.getString("response_data"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
