package com.flagship.invoice_followup.template;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MessageTemplateRepository extends JpaRepository<MessageTemplateEntity, UUID> {

    /**
     * Company-specific templates together with the global defaults.
     */
    @Query("""
        SELECT t FROM MessageTemplateEntity t
        WHERE t.companyId = :companyId OR t.companyId IS NULL
        ORDER BY t.dayOffset ASC
        """)
    List<MessageTemplateEntity> findApplicableTo(@Param("companyId") UUID companyId);
}
