package com.flagship.media_ledger.creation;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A single paid generation request.
 *
 * Transitions return new instances and reject moves the state machine does
 * not allow. Persistence applies the same moves with conditional updates,
 * so concurrent writers cannot both succeed.
 */
@Value
public class Creation {
    UUID id;
    String ownerId;
    CreationKind kind;
    String prompt;
    String aspectRatio;
    long cost;
    CreationStatus status;
    String outputRef;
    String failureReason;
    UUID debitEntryId;
    boolean refunded;
    Instant createdAt;
    Instant updatedAt;

    public static Creation create(UUID id, String ownerId, CreationKind kind, String prompt,
                                  String aspectRatio, long cost, UUID debitEntryId, Instant now) {
        return new Creation(id, ownerId, kind, prompt, aspectRatio, cost,
            CreationStatus.PENDING, null, null, debitEntryId, false, now, now);
    }

    public Creation markProcessing(Instant now) {
        return transition(CreationStatus.PROCESSING, outputRef, failureReason, now);
    }

    public Creation complete(String outputRef, Instant now) {
        if (outputRef == null || outputRef.isBlank()) {
            throw new IllegalArgumentException("Output reference is required to complete a creation");
        }
        return transition(CreationStatus.READY, outputRef, null, now);
    }

    public Creation fail(String reason, Instant now) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return transition(CreationStatus.FAILED, outputRef, reason, now);
    }

    public Creation publish(Instant now) {
        return transition(CreationStatus.PUBLISHED, outputRef, failureReason, now);
    }

    public Creation markRefunded() {
        if (status != CreationStatus.FAILED) {
            throw new IllegalStateException("Only FAILED creations are refunded, creation " + id + " is " + status);
        }
        return new Creation(id, ownerId, kind, prompt, aspectRatio, cost, status, outputRef,
            failureReason, debitEntryId, true, createdAt, updatedAt);
    }

    /**
     * Where the worker is asked to write the result.
     */
    public String expectedOutputPath() {
        return "creations/" + ownerId + "/" + id + "." + kind.getExtension();
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    private Creation transition(CreationStatus target, String newOutputRef, String newFailureReason, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move creation %s from %s to %s", id, status, target));
        }
        return new Creation(id, ownerId, kind, prompt, aspectRatio, cost, target, newOutputRef,
            newFailureReason, debitEntryId, refunded, createdAt, now);
    }
}
