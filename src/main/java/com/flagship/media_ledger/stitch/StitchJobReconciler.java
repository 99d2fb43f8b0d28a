package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.stitch.runner.RunnerStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides a job's real status from independent signals, without side effects.
 *
 * Signals are consulted in order and the first conclusive one wins:
 * 1. output present in the object store: COMPLETED
 * 2. runner status: SUCCEEDED is COMPLETED, FAILED is FAILED, RUNNING moves QUEUED to RUNNING
 * 3. staleness: non-terminal for longer than the timeout since the last status change: FAILED
 */
@Component
public class StitchJobReconciler {

    static final String TIMED_OUT_PREFIX = "timed out";

    private final Duration staleTimeout;

    public StitchJobReconciler(@Value("${media.stitch.stale-timeout:15m}") Duration staleTimeout) {
        if (staleTimeout.isNegative() || staleTimeout.isZero()) {
            throw new IllegalArgumentException("Stale timeout must be positive");
        }
        this.staleTimeout = staleTimeout;
    }

    public ReconciliationOutcome reconcile(StitchJob job, ReconciliationSignals signals, Instant now) {
        if (job.isTerminal()) {
            return ReconciliationOutcome.unchanged(job);
        }

        if (Boolean.TRUE.equals(signals.getOutputExists())) {
            return ReconciliationOutcome.changed(
                job.complete("Output found at " + job.getOutputPath(), now), DecidingSignal.OUTPUT_PRESENT);
        }

        RunnerStatus runnerStatus = signals.getRunnerStatus();
        if (runnerStatus == RunnerStatus.SUCCEEDED) {
            return ReconciliationOutcome.changed(
                job.complete(runnerMessage("Runner reported success", signals), now), DecidingSignal.RUNNER_STATUS);
        }
        if (runnerStatus == RunnerStatus.FAILED) {
            return ReconciliationOutcome.changed(
                job.fail(runnerMessage("Runner reported failure", signals), now), DecidingSignal.RUNNER_STATUS);
        }

        if (isStale(job, now)) {
            return ReconciliationOutcome.changed(
                job.fail(String.format("%s after %d minutes without a status change",
                    TIMED_OUT_PREFIX, staleTimeout.toMinutes()), now),
                DecidingSignal.STALENESS);
        }

        if (runnerStatus == RunnerStatus.RUNNING && job.getStatus() == StitchJobStatus.QUEUED) {
            return ReconciliationOutcome.changed(job.start("Running", now), DecidingSignal.RUNNER_STATUS);
        }

        return ReconciliationOutcome.unchanged(job);
    }

    private String runnerMessage(String base, ReconciliationSignals signals) {
        String detail = signals.getRunnerMessage();
        return detail == null || detail.isBlank() ? base : base + ": " + detail;
    }

    public boolean isStale(StitchJob job, Instant now) {
        return !job.isTerminal() && job.getUpdatedAt().plus(staleTimeout).isBefore(now);
    }

    public Duration getStaleTimeout() {
        return staleTimeout;
    }
}
