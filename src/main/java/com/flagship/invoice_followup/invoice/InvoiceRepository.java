package com.flagship.invoice_followup.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    /**
     * Invoices of one company that may receive reminders and whose due date falls in the
     * window the scanner can still act on.
     *
     * @param companyId Owning company
     * @param statuses Collectible statuses
     * @param dueFrom Earliest due date that can still produce a send window
     * @param dueTo Latest due date whose earliest template window has opened
     */
    @Query("""
        SELECT i FROM InvoiceEntity i
        WHERE i.companyId = :companyId
        AND i.excluded = false
        AND i.status IN :statuses
        AND i.dueDate BETWEEN :dueFrom AND :dueTo
        ORDER BY i.dueDate ASC
        """)
    List<InvoiceEntity> findFollowUpEligible(
        @Param("companyId") UUID companyId,
        @Param("statuses") Collection<InvoiceStatus> statuses,
        @Param("dueFrom") LocalDate dueFrom,
        @Param("dueTo") LocalDate dueTo);
}
