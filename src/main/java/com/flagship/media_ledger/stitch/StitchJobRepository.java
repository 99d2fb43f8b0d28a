package com.flagship.media_ledger.stitch;

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

@Repository
public interface StitchJobRepository extends JpaRepository<StitchJobEntity, UUID> {

    Optional<StitchJobEntity> findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(
        String targetId, Collection<StitchJobStatus> statuses);

    List<StitchJobEntity> findByTargetIdOrderByCreatedAtDesc(String targetId);

    List<StitchJobEntity> findByStatusIn(Collection<StitchJobStatus> statuses);

    /**
     * Failed, charged jobs whose refund has not been recorded.
     */
    @Query("""
        SELECT j FROM StitchJobEntity j
        WHERE j.status = com.flagship.media_ledger.stitch.StitchJobStatus.FAILED
        AND j.refunded = false AND j.debitEntryId IS NOT NULL
        """)
    List<StitchJobEntity> findUnrefundedFailures();

    long countByStatusIn(Collection<StitchJobStatus> statuses);

    long countByStatusInAndUpdatedAtBefore(Collection<StitchJobStatus> statuses, Instant cutoff);

    /**
     * Compare-and-set on the status the caller read.
     *
     * @return 1 if applied, 0 if the job had already moved on
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE StitchJobEntity j
        SET j.status = :target, j.message = :message, j.updatedAt = :updatedAt, j.completedAt = :completedAt
        WHERE j.id = :id AND j.status = :expected
        """)
    int applyTransition(@Param("id") UUID id,
                        @Param("expected") StitchJobStatus expected,
                        @Param("target") StitchJobStatus target,
                        @Param("message") String message,
                        @Param("updatedAt") Instant updatedAt,
                        @Param("completedAt") Instant completedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StitchJobEntity j SET j.executionRef = :executionRef WHERE j.id = :id AND j.executionRef IS NULL")
    int recordExecutionRef(@Param("id") UUID id, @Param("executionRef") String executionRef);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE StitchJobEntity j SET j.refunded = true
        WHERE j.id = :id
        AND j.status = com.flagship.media_ledger.stitch.StitchJobStatus.FAILED
        AND j.refunded = false
        """)
    int claimRefund(@Param("id") UUID id);
}
