package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.CorrelationContext;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.flagship.media_ledger.storage.ObjectStore;
import com.flagship.media_ledger.storage.ObjectStoreException;
import com.flagship.media_ledger.stitch.runner.JobRunnerClient;
import com.flagship.media_ledger.stitch.runner.JobRunnerException;
import com.flagship.media_ledger.stitch.runner.RunnerStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.UUID;

/**
 * Gathers signals for stitch jobs, lets {@link StitchJobReconciler} decide,
 * and persists the decision.
 *
 * Persistence is a compare-and-set on the status that was read, so two
 * instances reconciling the same job cannot both move it. A transition
 * to FAILED of a charged job refunds it once, guarded by the refunded flag.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    private final StitchJobRepository repository;
    private final StitchJobReconciler reconciler;
    private final ObjectStore objectStore;
    private final JobRunnerClient runnerClient;
    private final TokenLedgerService ledgerService;
    private final TransactionTemplate transactionTemplate;
    private final MediaMetrics metrics;
    private final Clock clock;

    public ReconciliationEngine(StitchJobRepository repository,
                                StitchJobReconciler reconciler,
                                ObjectStore objectStore,
                                JobRunnerClient runnerClient,
                                TokenLedgerService ledgerService,
                                TransactionTemplate transactionTemplate,
                                MediaMetrics metrics,
                                Clock clock) {
        this.repository = repository;
        this.reconciler = reconciler;
        this.objectStore = objectStore;
        this.runnerClient = runnerClient;
        this.ledgerService = ledgerService;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Brings the stored job in line with the external signals and returns the corrected job.
     */
    public StitchJob reconcile(StitchJob job) {
        try (MDC.MDCCloseable ignored = CorrelationContext.withMdc(CorrelationContext.JOB_ID_MDC_KEY, job.getId())) {
            if (job.isTerminal()) {
                return job.needsRefund() ? transactionTemplate.execute(status -> refundOnce(job)) : job;
            }
            return apply(job, gatherSignals(job));
        }
    }

    /**
     * Applies a status pushed by the runner through the same decision path.
     */
    public StitchJob applyRunnerReport(StitchJob job, RunnerStatus status, String message) {
        try (MDC.MDCCloseable ignored = CorrelationContext.withMdc(CorrelationContext.JOB_ID_MDC_KEY, job.getId())) {
            if (job.isTerminal()) {
                log.info("Ignoring runner report {} for job {} already {}", status, job.getId(), job.getStatus());
                return job;
            }
            return apply(job, ReconciliationSignals.runnerReport(status, message));
        }
    }

    /**
     * Fails a job outright (used when the runner never accepted it) and refunds it.
     */
    public StitchJob markFailed(StitchJob job, String reason) {
        StitchJob failed = job.fail(reason, clock.instant());
        StitchJob result = transactionTemplate.execute(status -> persist(job, failed));
        metrics.recordReconciliation("submit_failure", result.getStatus().name());
        return result;
    }

    /**
     * Reconciles every non-terminal job and retries refunds that were not recorded.
     *
     * @return number of jobs whose stored state changed
     */
    public int reconcileAll() {
        int changed = 0;
        for (StitchJobEntity entity : repository.findByStatusIn(StitchJobStatus.ACTIVE)) {
            StitchJob job = entity.toDomain();
            try {
                StitchJob result = reconcile(job);
                if (result.getStatus() != job.getStatus()) {
                    changed++;
                }
            } catch (RuntimeException e) {
                log.error("Reconciliation of job {} failed, will retry on next sweep", job.getId(), e);
            }
        }
        for (StitchJobEntity entity : repository.findUnrefundedFailures()) {
            try {
                reconcile(entity.toDomain());
            } catch (RuntimeException e) {
                log.error("Refund of job {} failed, will retry on next sweep", entity.getId(), e);
            }
        }
        return changed;
    }

    /**
     * Output first; the runner is only asked when the output is not known to exist.
     */
    ReconciliationSignals gatherSignals(StitchJob job) {
        Boolean outputExists = probeOutput(job);
        if (Boolean.TRUE.equals(outputExists)) {
            return ReconciliationSignals.outputPresent();
        }
        return ReconciliationSignals.of(outputExists, queryRunner(job));
    }

    private Boolean probeOutput(StitchJob job) {
        try {
            return objectStore.exists(job.getOutputPath());
        } catch (ObjectStoreException e) {
            log.warn("Output check failed for job {}, treating as unknown: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private RunnerStatus queryRunner(StitchJob job) {
        if (job.getExecutionRef() == null) {
            return null;
        }
        try {
            return runnerClient.getStatus(job.getExecutionRef());
        } catch (JobRunnerException e) {
            log.warn("Runner status unknown for job {}: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private StitchJob apply(StitchJob job, ReconciliationSignals signals) {
        ReconciliationOutcome outcome = reconciler.reconcile(job, signals, clock.instant());
        if (!outcome.isChanged()) {
            return job;
        }
        StitchJob result = transactionTemplate.execute(status -> persist(job, outcome.getJob()));
        metrics.recordReconciliation(outcome.getDecidedBy().name(), result.getStatus().name());
        return result;
    }

    private StitchJob persist(StitchJob read, StitchJob target) {
        int updated = repository.applyTransition(read.getId(), read.getStatus(), target.getStatus(),
            target.getMessage(), target.getUpdatedAt(), target.getCompletedAt());
        if (updated == 0) {
            StitchJob stored = load(read.getId());
            log.info("Job {} moved from {} to {} concurrently, keeping stored state",
                read.getId(), read.getStatus(), stored.getStatus());
            return stored.needsRefund() ? refundOnce(stored) : stored;
        }
        log.info("Job {} {} -> {}: {}", read.getId(), read.getStatus(), target.getStatus(), target.getMessage());
        return target.needsRefund() ? refundOnce(target) : target;
    }

    private StitchJob refundOnce(StitchJob job) {
        if (repository.claimRefund(job.getId()) == 0) {
            log.debug("Refund for job {} already claimed", job.getId());
            return load(job.getId());
        }
        ledgerService.refund(job.getOwnerId(), job.getCost(), job.getId().toString());
        metrics.recordRefund("stitch");
        return job.markRefunded();
    }

    StitchJob load(UUID id) {
        return repository.findById(id)
            .map(StitchJobEntity::toDomain)
            .orElseThrow(() -> new StitchJobNotFoundException(id));
    }
}
