package com.flagship.invoice_followup.credential;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CredentialRecordRepository extends JpaRepository<CredentialRecordEntity, UUID> {

    Optional<CredentialRecordEntity> findByOwnerId(UUID ownerId);

    /**
     * SELECT ... FOR UPDATE on the owner's row. Serializes refreshers across instances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CredentialRecordEntity c WHERE c.ownerId = :ownerId")
    Optional<CredentialRecordEntity> findByOwnerIdForUpdate(@Param("ownerId") UUID ownerId);

    @Query("""
        SELECT c.ownerId FROM CredentialRecordEntity c
        WHERE c.status = com.flagship.invoice_followup.credential.CredentialStatus.ACTIVE
        AND c.accessTokenExpiresAt <= :threshold
        ORDER BY c.accessTokenExpiresAt ASC
        """)
    List<UUID> findActiveOwnersExpiringBefore(@Param("threshold") Instant threshold);

    @Modifying
    @Query("DELETE FROM CredentialRecordEntity c WHERE c.ownerId = :ownerId")
    int deleteByOwnerId(@Param("ownerId") UUID ownerId);
}
