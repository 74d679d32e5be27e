package com.flagship.invoice_followup.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A customer account of the service. Owns invoices, company templates and the
 * accounting-system credential.
 *
 * A paused company (account suspended) gets no new follow-ups; sends already in
 * flight are not interrupted.
 */
@Entity
@Table(name = "companies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CompanyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean paused;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public CompanyEntity(UUID id, String name) {
        this.id = id;
        this.name = name;
        this.paused = false;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public void pause() {
        this.paused = true;
    }

    public void resume() {
        this.paused = false;
    }
}
