package com.flagship.media_ledger.stitch;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for stitch jobs. Status changes go through the conditional
 * updates in {@link StitchJobRepository}; the partial unique index on
 * target_id keeps at most one QUEUED or RUNNING job per target.
 */
@Entity
@Table(name = "stitch_jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StitchJobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "target_id", nullable = false, updatable = false)
    private String targetId;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 128)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "stitch_job_inputs", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "input_path", nullable = false, length = 1024)
    private List<String> inputPaths = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StitchJobStatus status;

    @Column(name = "execution_ref")
    private String executionRef;

    @Column(name = "output_path", nullable = false, updatable = false, length = 1024)
    private String outputPath;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(nullable = false, updatable = false)
    private long cost;

    @Column(name = "debit_entry_id", updatable = false)
    private UUID debitEntryId;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    static StitchJobEntity fromDomain(StitchJob job) {
        return new StitchJobEntity(
            job.getId(),
            job.getTargetId(),
            job.getOwnerId(),
            new ArrayList<>(job.getInputPaths()),
            job.getStatus(),
            job.getExecutionRef(),
            job.getOutputPath(),
            job.getMessage(),
            job.getCost(),
            job.getDebitEntryId(),
            job.isRefunded(),
            job.getCreatedAt(),
            job.getUpdatedAt(),
            job.getCompletedAt()
        );
    }

    public StitchJob toDomain() {
        return new StitchJob(
            id,
            targetId,
            ownerId,
            List.copyOf(inputPaths),
            status,
            executionRef,
            outputPath,
            message,
            cost,
            debitEntryId,
            refunded,
            createdAt,
            updatedAt,
            completedAt
        );
    }
}
