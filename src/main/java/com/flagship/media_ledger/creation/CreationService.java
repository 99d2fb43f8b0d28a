package com.flagship.media_ledger.creation;

import com.flagship.media_ledger.common.exception.EnqueueFailureException;
import com.flagship.media_ledger.common.exception.NotOwnerException;
import com.flagship.media_ledger.ledger.LedgerEntry;
import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.CorrelationContext;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.flagship.media_ledger.storage.ObjectStore;
import com.flagship.media_ledger.storage.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of paid generation requests.
 *
 * Guarantees:
 * - The debit and the PENDING record are written in one transaction
 * - A creation whose task could not be enqueued is FAILED and refunded before the caller sees the error
 * - Every FAILED creation is refunded exactly once, guarded by the {@code refunded} flag
 * - Completion is first-writer-wins; later conflicting outputs are ignored
 *
 * Each public mutation runs in its own transaction through {@link TransactionTemplate},
 * so internal calls (submit failing its own record, the stale sweep) get one too.
 */
@Service
@Slf4j
public class CreationService {

    public static final int MAX_PROMPT_LENGTH = 500;
    static final String ENQUEUE_FAILED_REASON = "enqueue failed";
    static final String TIMED_OUT_REASON = "timed out";

    private final CreationRepository repository;
    private final TokenLedgerService ledgerService;
    private final GenerationTaskPublisher taskPublisher;
    private final CreationPricing pricing;
    private final ObjectStore objectStore;
    private final TransactionTemplate transactionTemplate;
    private final MediaMetrics metrics;
    private final Clock clock;
    private final Duration staleTimeout;
    private final Duration urlTtl;

    public CreationService(CreationRepository repository,
                           TokenLedgerService ledgerService,
                           GenerationTaskPublisher taskPublisher,
                           CreationPricing pricing,
                           ObjectStore objectStore,
                           TransactionTemplate transactionTemplate,
                           MediaMetrics metrics,
                           Clock clock,
                           @Value("${media.creation.stale-timeout:1h}") Duration staleTimeout,
                           @Value("${storage.url-ttl:1h}") Duration urlTtl) {
        this.repository = repository;
        this.ledgerService = ledgerService;
        this.taskPublisher = taskPublisher;
        this.pricing = pricing;
        this.objectStore = objectStore;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.staleTimeout = staleTimeout;
        this.urlTtl = urlTtl;
    }

    /**
     * Charges the owner, records a PENDING creation and enqueues its generation task.
     *
     * @throws com.flagship.media_ledger.common.exception.InsufficientBalanceException if the owner cannot pay; nothing is written
     * @throws EnqueueFailureException if the task could not be enqueued; the creation is FAILED and refunded
     */
    public Creation submit(String ownerId, CreationKind kind, String prompt, String aspectRatio) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Creation kind is required");
        }
        String normalizedPrompt = validatePrompt(prompt);
        long cost = pricing.costOf(kind);

        return metrics.timeSubmit(() -> {
            Creation creation = transactionTemplate.execute(status -> {
                UUID id = UUID.randomUUID();
                LedgerEntry debit = ledgerService.debit(ownerId, cost, id.toString());
                Creation pending = Creation.create(id, ownerId, kind, normalizedPrompt, aspectRatio,
                    cost, debit.getId(), clock.instant());
                repository.save(CreationEntity.fromDomain(pending));
                return pending;
            });

            try (MDC.MDCCloseable ignored = CorrelationContext.withMdc(
                    CorrelationContext.CREATION_ID_MDC_KEY, creation.getId())) {
                enqueue(creation);
                metrics.recordCreationSubmitted(kind.name());
                log.info("Creation {} submitted: kind={}, cost={}", creation.getId(), kind, cost);
                return creation;
            }
        });
    }

    private void enqueue(Creation creation) {
        try {
            taskPublisher.publish(GenerationTask.from(creation));
        } catch (RuntimeException cause) {
            EnqueueFailureException e = cause instanceof EnqueueFailureException
                ? (EnqueueFailureException) cause
                : new EnqueueFailureException("Failed to enqueue generation task " + creation.getId(), cause);
            metrics.recordEnqueueFailure("generation");
            log.warn("Enqueue failed for creation {}, failing and refunding", creation.getId());
            try {
                fail(creation.getId(), ENQUEUE_FAILED_REASON);
            } catch (RuntimeException refundFailure) {
                // The stale sweep refunds it later; the caller still learns the enqueue failed.
                log.error("Could not fail creation {} after enqueue failure", creation.getId(), refundFailure);
                e.addSuppressed(refundFailure);
            }
            throw e;
        }
    }

    /**
     * PENDING to PROCESSING. Anything else is a logged no-op.
     */
    public Creation markProcessing(UUID id) {
        return transactionTemplate.execute(status -> {
            Creation creation = load(id);
            if (!creation.getStatus().canTransitionTo(CreationStatus.PROCESSING)) {
                log.info("Ignoring start of creation {} in status {}", id, creation.getStatus());
                return creation;
            }
            Instant now = clock.instant();
            if (repository.updateStatus(id, creation.getStatus(), CreationStatus.PROCESSING, now) == 0) {
                log.info("Creation {} changed concurrently, start not applied", id);
                return load(id);
            }
            metrics.recordCreationTransition(CreationStatus.PROCESSING.name());
            return creation.markProcessing(now);
        });
    }

    /**
     * Records the generated output. The first completion wins; repeats and
     * completions of FAILED creations are ignored.
     */
    public Creation complete(UUID id, String outputRef) {
        if (outputRef == null || outputRef.isBlank()) {
            throw new IllegalArgumentException("Output reference is required");
        }
        return transactionTemplate.execute(status -> {
            Creation creation = load(id);
            if (creation.getStatus() == CreationStatus.READY || creation.getStatus() == CreationStatus.PUBLISHED) {
                if (!outputRef.equals(creation.getOutputRef())) {
                    log.warn("Ignoring conflicting output {} for creation {}, already completed with {}",
                        outputRef, id, creation.getOutputRef());
                } else {
                    log.info("Duplicate completion for creation {}", id);
                }
                return creation;
            }
            if (!creation.getStatus().canTransitionTo(CreationStatus.READY)) {
                log.info("Ignoring completion of creation {} in status {}", id, creation.getStatus());
                return creation;
            }
            Instant now = clock.instant();
            if (repository.markReady(id, creation.getStatus(), outputRef, now) == 0) {
                log.info("Creation {} changed concurrently, completion not applied", id);
                return load(id);
            }
            metrics.recordCreationTransition(CreationStatus.READY.name());
            log.info("Creation {} ready: {}", id, outputRef);
            return creation.complete(outputRef, now);
        });
    }

    /**
     * Fails the creation and refunds its cost. Safe to call repeatedly: an
     * already FAILED creation is only refunded if that has not happened yet.
     */
    public Creation fail(UUID id, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return transactionTemplate.execute(status -> {
            Creation creation = load(id);
            if (creation.getStatus().canTransitionTo(CreationStatus.FAILED)) {
                Instant now = clock.instant();
                if (repository.markFailed(id, creation.getStatus(), reason, now) == 1) {
                    creation = creation.fail(reason, now);
                    metrics.recordCreationTransition(CreationStatus.FAILED.name());
                    log.info("Creation {} failed: {}", id, reason);
                } else {
                    creation = load(id);
                }
            }
            if (creation.getStatus() != CreationStatus.FAILED) {
                log.info("Ignoring failure of creation {} in status {}", id, creation.getStatus());
                return creation;
            }
            return refundOnce(creation);
        });
    }

    private Creation refundOnce(Creation creation) {
        if (creation.isRefunded()) {
            return creation;
        }
        if (repository.claimRefund(creation.getId()) == 0) {
            log.debug("Refund for creation {} already claimed", creation.getId());
            return load(creation.getId());
        }
        ledgerService.refund(creation.getOwnerId(), creation.getCost(), creation.getId().toString());
        metrics.recordRefund("creation");
        return creation.markRefunded();
    }

    /**
     * READY to PUBLISHED; only the owner may publish.
     */
    public Creation publish(UUID id, String userId) {
        return transactionTemplate.execute(status -> {
            Creation creation = load(id);
            if (!creation.isOwnedBy(userId)) {
                throw new NotOwnerException("Creation " + id, userId);
            }
            if (creation.getStatus() == CreationStatus.PUBLISHED) {
                return creation;
            }
            Creation published = creation.publish(clock.instant());
            if (repository.updateStatus(id, CreationStatus.READY, CreationStatus.PUBLISHED, published.getUpdatedAt()) == 0) {
                throw new IllegalStateException("Creation " + id + " changed concurrently, retry");
            }
            metrics.recordCreationTransition(CreationStatus.PUBLISHED.name());
            return published;
        });
    }

    public Creation get(UUID id) {
        return load(id);
    }

    public List<Creation> listForOwner(String ownerId) {
        return repository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
            .map(CreationEntity::toDomain)
            .toList();
    }

    /**
     * Time-limited URL for a completed creation's output.
     */
    public Optional<String> outputUrl(Creation creation) {
        if (creation.getOutputRef() == null) {
            return Optional.empty();
        }
        return Optional.of(objectStore.generateTimeLimitedUrl(creation.getOutputRef(), urlTtl));
    }

    /**
     * Resolves creations that stopped hearing from their worker: completes
     * those whose output exists, fails and refunds the rest. Also retries
     * refunds that a previous failure could not record.
     *
     * @return number of creations resolved
     */
    public int sweepStale() {
        Instant cutoff = clock.instant().minus(staleTimeout);
        int resolved = 0;

        for (CreationEntity entity : repository.findByStatusInAndUpdatedAtBefore(
                List.of(CreationStatus.PENDING, CreationStatus.PROCESSING), cutoff)) {
            Creation creation = entity.toDomain();
            try (MDC.MDCCloseable ignored = CorrelationContext.withMdc(
                    CorrelationContext.CREATION_ID_MDC_KEY, creation.getId())) {
                if (resolveStale(creation)) {
                    resolved++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to resolve stale creation {}, will retry on next sweep", creation.getId(), e);
            }
        }

        for (CreationEntity entity : repository.findByStatusAndRefundedFalse(CreationStatus.FAILED)) {
            try {
                fail(entity.getId(), entity.getFailureReason() != null ? entity.getFailureReason() : TIMED_OUT_REASON);
                resolved++;
            } catch (RuntimeException e) {
                log.error("Failed to refund creation {}, will retry on next sweep", entity.getId(), e);
            }
        }
        return resolved;
    }

    private boolean resolveStale(Creation creation) {
        String outputPath = creation.expectedOutputPath();
        boolean outputExists;
        try {
            outputExists = objectStore.exists(outputPath);
        } catch (ObjectStoreException e) {
            log.warn("Object store unavailable while checking {}, leaving creation {} for next sweep",
                outputPath, creation.getId());
            return false;
        }
        if (outputExists) {
            log.info("Stale creation {} has output at {}, completing", creation.getId(), outputPath);
            complete(creation.getId(), outputPath);
        } else {
            log.info("Stale creation {} has no output, failing", creation.getId());
            fail(creation.getId(), TIMED_OUT_REASON);
        }
        return true;
    }

    private Creation load(UUID id) {
        return repository.findById(id)
            .map(CreationEntity::toDomain)
            .orElseThrow(() -> new CreationNotFoundException(id));
    }

    private String validatePrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        String trimmed = prompt.trim();
        if (trimmed.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException(
                "Prompt must be at most " + MAX_PROMPT_LENGTH + " characters, got " + trimmed.length());
        }
        return trimmed;
    }
}
