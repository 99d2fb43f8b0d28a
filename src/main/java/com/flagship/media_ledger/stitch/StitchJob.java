package com.flagship.media_ledger.stitch;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A request to stitch ordered input clips into one output for a target.
 *
 * {@code updatedAt} is the time of the last status change and is what the
 * staleness timeout is measured from.
 */
@Value
public class StitchJob {
    UUID id;
    String targetId;
    String ownerId;
    List<String> inputPaths;
    StitchJobStatus status;
    String executionRef;
    String outputPath;
    String message;
    long cost;
    UUID debitEntryId;
    boolean refunded;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    public static StitchJob create(UUID id, String targetId, String ownerId, List<String> inputPaths,
                                   String outputPath, long cost, UUID debitEntryId, Instant now) {
        return new StitchJob(id, targetId, ownerId, List.copyOf(inputPaths), StitchJobStatus.QUEUED,
            null, outputPath, "Queued", cost, debitEntryId, false, now, now, null);
    }

    public StitchJob start(String message, Instant now) {
        return transition(StitchJobStatus.RUNNING, message, now, null);
    }

    public StitchJob complete(String message, Instant now) {
        return transition(StitchJobStatus.COMPLETED, message, now, now);
    }

    public StitchJob fail(String message, Instant now) {
        return transition(StitchJobStatus.FAILED, message, now, now);
    }

    public StitchJob withExecutionRef(String ref) {
        return new StitchJob(id, targetId, ownerId, inputPaths, status, ref, outputPath, message, cost,
            debitEntryId, refunded, createdAt, updatedAt, completedAt);
    }

    public StitchJob markRefunded() {
        return new StitchJob(id, targetId, ownerId, inputPaths, status, executionRef, outputPath, message, cost,
            debitEntryId, true, createdAt, updatedAt, completedAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * True when a failure of this job owes the owner a refund.
     */
    public boolean needsRefund() {
        return status == StitchJobStatus.FAILED && debitEntryId != null && cost > 0 && !refunded;
    }

    private StitchJob transition(StitchJobStatus target, String newMessage, Instant now, Instant newCompletedAt) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move stitch job %s from %s to %s", id, status, target));
        }
        return new StitchJob(id, targetId, ownerId, inputPaths, target, executionRef, outputPath, newMessage,
            cost, debitEntryId, refunded, createdAt, now, newCompletedAt);
    }
}
