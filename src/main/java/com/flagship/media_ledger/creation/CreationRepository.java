package com.flagship.media_ledger.creation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Creation persistence. The update methods are compare-and-set: they return
 * the number of rows changed, which is 0 when the record was no longer in
 * the expected status.
 */
@Repository
public interface CreationRepository extends JpaRepository<CreationEntity, UUID> {

    List<CreationEntity> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<CreationEntity> findByStatusInAndUpdatedAtBefore(Collection<CreationStatus> statuses, Instant cutoff);

    /**
     * FAILED creations whose refund has not been recorded, e.g. after a crash
     * between the status change and the refund.
     */
    List<CreationEntity> findByStatusAndRefundedFalse(CreationStatus status);

    long countByStatusIn(Collection<CreationStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE CreationEntity c SET c.status = :target, c.updatedAt = :now
        WHERE c.id = :id AND c.status = :expected
        """)
    int updateStatus(@Param("id") UUID id,
                     @Param("expected") CreationStatus expected,
                     @Param("target") CreationStatus target,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE CreationEntity c
        SET c.status = com.flagship.media_ledger.creation.CreationStatus.READY,
            c.outputRef = :outputRef, c.failureReason = null, c.updatedAt = :now
        WHERE c.id = :id AND c.status = :expected
        """)
    int markReady(@Param("id") UUID id,
                  @Param("expected") CreationStatus expected,
                  @Param("outputRef") String outputRef,
                  @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE CreationEntity c
        SET c.status = com.flagship.media_ledger.creation.CreationStatus.FAILED,
            c.failureReason = :reason, c.updatedAt = :now
        WHERE c.id = :id AND c.status = :expected
        """)
    int markFailed(@Param("id") UUID id,
                   @Param("expected") CreationStatus expected,
                   @Param("reason") String reason,
                   @Param("now") Instant now);

    /**
     * Claims the right to refund a failed creation. Only one caller can see 1.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE CreationEntity c SET c.refunded = true
        WHERE c.id = :id
        AND c.status = com.flagship.media_ledger.creation.CreationStatus.FAILED
        AND c.refunded = false
        """)
    int claimRefund(@Param("id") UUID id);
}
