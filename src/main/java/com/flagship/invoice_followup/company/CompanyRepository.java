package com.flagship.invoice_followup.company;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CompanyRepository extends JpaRepository<CompanyEntity, UUID> {

    /**
     * Companies whose follow-ups may be scanned.
     */
    List<CompanyEntity> findByPausedFalse();
}
