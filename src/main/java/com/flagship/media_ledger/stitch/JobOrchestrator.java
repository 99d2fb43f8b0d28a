package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.common.exception.AlreadyRunningException;
import com.flagship.media_ledger.common.exception.EnqueueFailureException;
import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.CorrelationContext;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.flagship.media_ledger.storage.ObjectStore;
import com.flagship.media_ledger.stitch.runner.JobRunnerClient;
import com.flagship.media_ledger.stitch.runner.JobRunnerException;
import com.flagship.media_ledger.stitch.runner.RunnerStatus;
import com.flagship.media_ledger.stitch.runner.StitchJobSpec;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for stitch jobs.
 *
 * Stored "active" state is never trusted on its own: every read of an
 * active job reconciles it first, so a job whose worker died does not
 * block its target forever. Failed jobs are not resumed; a new enqueue
 * starts over with a new job id.
 */
@Service
@Slf4j
public class JobOrchestrator {

    private final StitchJobRepository repository;
    private final ReconciliationEngine reconciliationEngine;
    private final JobRunnerClient runnerClient;
    private final TokenLedgerService ledgerService;
    private final ObjectStore objectStore;
    private final TransactionTemplate transactionTemplate;
    private final MediaMetrics metrics;
    private final Clock clock;
    private final long stitchCost;
    private final int minInputs;
    private final String outputPrefix;
    private final Duration urlTtl;

    public JobOrchestrator(StitchJobRepository repository,
                           ReconciliationEngine reconciliationEngine,
                           JobRunnerClient runnerClient,
                           TokenLedgerService ledgerService,
                           ObjectStore objectStore,
                           TransactionTemplate transactionTemplate,
                           MediaMetrics metrics,
                           Clock clock,
                           @Value("${media.stitch.cost:0}") long stitchCost,
                           @Value("${media.stitch.min-inputs:2}") int minInputs,
                           @Value("${media.stitch.output-prefix:stitched}") String outputPrefix,
                           @Value("${storage.url-ttl:1h}") Duration urlTtl) {
        if (stitchCost < 0) {
            throw new IllegalArgumentException("Stitch cost must not be negative");
        }
        this.repository = repository;
        this.reconciliationEngine = reconciliationEngine;
        this.runnerClient = runnerClient;
        this.ledgerService = ledgerService;
        this.objectStore = objectStore;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.stitchCost = stitchCost;
        this.minInputs = minInputs;
        this.outputPrefix = outputPrefix;
        this.urlTtl = urlTtl;
    }

    /**
     * Starts a stitch for the target.
     *
     * @throws AlreadyRunningException if the target still has an active job after reconciling it
     * @throws com.flagship.media_ledger.common.exception.InsufficientBalanceException if a stitch cost is configured and the owner cannot pay
     * @throws EnqueueFailureException if the runner did not accept the job; it is FAILED and refunded
     */
    public StitchJob enqueueStitch(String targetId, String ownerId, List<String> inputPaths) {
        validate(targetId, ownerId, inputPaths);

        Optional<StitchJob> active = getActiveJob(targetId);
        if (active.isPresent()) {
            throw new AlreadyRunningException(targetId, active.get().getId());
        }

        UUID jobId = UUID.randomUUID();
        String outputPath = outputPrefix + "/" + targetId + "/" + jobId + ".mp4";
        StitchJob job;
        try {
            job = transactionTemplate.execute(status -> {
                UUID debitEntryId = stitchCost > 0
                    ? ledgerService.debit(ownerId, stitchCost, jobId.toString()).getId()
                    : null;
                StitchJob queued = StitchJob.create(jobId, targetId, ownerId, inputPaths, outputPath,
                    stitchCost, debitEntryId, clock.instant());
                repository.saveAndFlush(StitchJobEntity.fromDomain(queued));
                return queued;
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent stitch enqueue for target {} won the race", targetId);
            UUID winner = repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(targetId, StitchJobStatus.ACTIVE)
                .map(StitchJobEntity::getId)
                .orElse(null);
            throw new AlreadyRunningException(targetId, winner);
        }

        try (MDC.MDCCloseable ignored = CorrelationContext.withMdc(CorrelationContext.JOB_ID_MDC_KEY, jobId)) {
            metrics.recordStitchEnqueued();
            log.info("Stitch job {} queued for target {} with {} inputs", jobId, targetId, inputPaths.size());
            return submitToRunner(job);
        }
    }

    private StitchJob submitToRunner(StitchJob job) {
        String executionRef;
        try {
            executionRef = runnerClient.submit(StitchJobSpec.from(job));
        } catch (JobRunnerException e) {
            metrics.recordEnqueueFailure("stitch");
            log.warn("Runner did not accept job {}, failing it", job.getId());
            try {
                reconciliationEngine.markFailed(job, "submit failed: " + e.getMessage());
            } catch (RuntimeException failure) {
                // The reconciliation sweep fails and refunds it once the job goes stale.
                log.error("Could not fail job {} after submit failure", job.getId(), failure);
                e.addSuppressed(failure);
            }
            throw new EnqueueFailureException("Failed to submit stitch job " + job.getId(), e);
        }

        transactionTemplate.executeWithoutResult(status ->
            repository.recordExecutionRef(job.getId(), executionRef));
        return job.withExecutionRef(executionRef);
    }

    /**
     * The target's active job after reconciliation; empty if it turned out to be finished.
     */
    public Optional<StitchJob> getActiveJob(String targetId) {
        return repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(targetId, StitchJobStatus.ACTIVE)
            .map(StitchJobEntity::toDomain)
            .map(reconciliationEngine::reconcile)
            .filter(job -> !job.isTerminal());
    }

    public StitchJob getJob(UUID jobId) {
        return reconciliationEngine.reconcile(reconciliationEngine.load(jobId));
    }

    public List<StitchJob> listJobs(String targetId) {
        return repository.findByTargetIdOrderByCreatedAtDesc(targetId).stream()
            .map(StitchJobEntity::toDomain)
            .toList();
    }

    public StitchJob onRunnerCallback(UUID jobId, RunnerStatus status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("Runner status is required");
        }
        log.info("Runner callback for job {}: {} {}", jobId, status, message != null ? message : "");
        return reconciliationEngine.applyRunnerReport(reconciliationEngine.load(jobId), status, message);
    }

    public Optional<String> outputUrl(StitchJob job) {
        if (job.getStatus() != StitchJobStatus.COMPLETED) {
            return Optional.empty();
        }
        return Optional.of(objectStore.generateTimeLimitedUrl(job.getOutputPath(), urlTtl));
    }

    private void validate(String targetId, String ownerId, List<String> inputPaths) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Target id is required");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (inputPaths == null || inputPaths.size() < minInputs) {
            throw new IllegalArgumentException("At least " + minInputs + " inputs are required to stitch");
        }
        if (inputPaths.stream().anyMatch(path -> path == null || path.isBlank())) {
            throw new IllegalArgumentException("Input paths must not be blank");
        }
    }
}
