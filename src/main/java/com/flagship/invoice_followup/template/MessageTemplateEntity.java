package com.flagship.invoice_followup.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for message templates.
 *
 * Uniqueness of (company, channel, day_offset) is enforced by two partial indexes in the
 * baseline migration: one for company rows and one for global rows.
 */
@Entity
@Table(name = "message_templates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MessageTemplateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", updatable = false)
    private UUID companyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Channel channel;

    @Column(name = "day_offset", nullable = false)
    private int dayOffset;

    @Column(length = 500)
    private String subject;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String body;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static MessageTemplateEntity fromDomain(MessageTemplate template) {
        return new MessageTemplateEntity(
            template.getId(),
            template.getCompanyId(),
            template.getChannel(),
            template.getDayOffset(),
            template.getSubject(),
            template.getBody(),
            null // createdAt - set by @PrePersist
        );
    }

    public MessageTemplate toDomain() {
        return MessageTemplate.builder()
            .id(id)
            .companyId(companyId)
            .channel(channel)
            .dayOffset(dayOffset)
            .subject(subject)
            .body(body)
            .build();
    }
}
