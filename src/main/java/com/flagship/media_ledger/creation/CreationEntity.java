package com.flagship.media_ledger.creation;

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
 * JPA entity for creations.
 *
 * No setters: after the insert, every change goes through a conditional
 * update in {@link CreationRepository} that names the status it expects.
 */
@Entity
@Table(name = "creations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 128)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private CreationKind kind;

    @Column(nullable = false, updatable = false, length = 500)
    private String prompt;

    @Column(name = "aspect_ratio", updatable = false, length = 16)
    private String aspectRatio;

    @Column(nullable = false, updatable = false)
    private long cost;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CreationStatus status;

    @Column(name = "output_ref", length = 1024)
    private String outputRef;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "debit_entry_id", nullable = false, updatable = false)
    private UUID debitEntryId;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static CreationEntity fromDomain(Creation creation) {
        return new CreationEntity(
            creation.getId(),
            creation.getOwnerId(),
            creation.getKind(),
            creation.getPrompt(),
            creation.getAspectRatio(),
            creation.getCost(),
            creation.getStatus(),
            creation.getOutputRef(),
            creation.getFailureReason(),
            creation.getDebitEntryId(),
            creation.isRefunded(),
            creation.getCreatedAt(),
            creation.getUpdatedAt()
        );
    }

    public Creation toDomain() {
        return new Creation(
            id,
            ownerId,
            kind,
            prompt,
            aspectRatio,
            cost,
            status,
            outputRef,
            failureReason,
            debitEntryId,
            refunded,
            createdAt,
            updatedAt
        );
    }
}
