package com.flagship.invoice_followup.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for invoices.
 *
 * No setters: the importer owns most columns. The only mutations allowed from this
 * service are the exclusion toggle and the follow-up timestamp.
 */
@Entity
@Table(
    name = "invoices",
    indexes = {
        @Index(name = "idx_invoices_company_due", columnList = "company_id, due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "external_invoice_id", nullable = false)
    private String externalInvoiceId;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone")
    private String customerPhone;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private InvoiceStatus status;

    @Column(nullable = false)
    private boolean excluded;

    @Column(name = "last_followup_at")
    private Instant lastFollowUpAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates an entity from a domain object. Used by tests and by importer tooling.
     */
    public static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(
            invoice.getId(),
            invoice.getCompanyId(),
            invoice.getExternalInvoiceId(),
            invoice.getCustomerName(),
            invoice.getCustomerEmail(),
            invoice.getCustomerPhone(),
            invoice.getAmount(),
            invoice.getCurrency(),
            invoice.getDueDate(),
            invoice.getStatus(),
            invoice.isExcluded(),
            invoice.getLastFollowUpAt(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Invoice toDomain() {
        return Invoice.builder()
            .id(id)
            .companyId(companyId)
            .externalInvoiceId(externalInvoiceId)
            .customerName(customerName)
            .customerEmail(customerEmail)
            .customerPhone(customerPhone)
            .amount(amount)
            .currency(currency)
            .dueDate(dueDate)
            .status(status)
            .excluded(excluded)
            .lastFollowUpAt(lastFollowUpAt)
            .build();
    }

    void setExcluded(boolean excluded) {
        this.excluded = excluded;
    }
}
