package com.flagship.media_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger, creation, stitch and webhook operations.
 *
 * Metrics exposed:
 * - ledger.entries: ledger entries written, tagged by type
 * - ledger.duplicates: idempotent no-ops, tagged by type
 * - ledger.insufficient_balance: rejected debits
 * - creation.submitted / creation.transitions: creation lifecycle
 * - enqueue.failures: task or job submissions that had to be rolled back
 * - stitch.reconciliations: reconciliation outcomes by deciding signal
 * - webhook.events: payment webhook outcomes
 * - operation.latency: timers around the request-path operations
 */
@Component
public class MediaMetrics {

    private final MeterRegistry registry;

    private final Counter insufficientBalance;
    private final Timer submitTimer;

    public MediaMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.insufficientBalance = Counter.builder("ledger.insufficient_balance")
                .description("Debits rejected because the balance was too low")
                .register(registry);

        this.submitTimer = Timer.builder("creation.submit.duration")
                .description("Time taken to debit, record and enqueue a creation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordLedgerEntry(String entryType, long amount) {
        registry.counter("ledger.entries", "type", sanitizeTag(entryType)).increment();
        registry.counter("ledger.tokens", "type", sanitizeTag(entryType)).increment(amount);
    }

    public void recordLedgerDuplicate(String entryType) {
        registry.counter("ledger.duplicates", "type", sanitizeTag(entryType)).increment();
    }

    public void incrementInsufficientBalance() {
        insufficientBalance.increment();
    }

    // ==================== Creations ====================

    public void recordCreationSubmitted(String kind) {
        registry.counter("creation.submitted", "kind", sanitizeTag(kind)).increment();
    }

    public void recordCreationTransition(String status) {
        registry.counter("creation.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordRefund(String source) {
        registry.counter("ledger.refunds", "source", sanitizeTag(source)).increment();
    }

    public void recordEnqueueFailure(String component) {
        registry.counter("enqueue.failures", "component", sanitizeTag(component)).increment();
    }

    public <T> T timeSubmit(Supplier<T> operation) {
        return submitTimer.record(operation);
    }

    // ==================== Stitch jobs ====================

    public void recordStitchEnqueued() {
        registry.counter("stitch.enqueued").increment();
    }

    public void recordReconciliation(String decidedBy, String outcome) {
        registry.counter("stitch.reconciliations",
                "decided_by", sanitizeTag(decidedBy),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Webhooks ====================

    public void recordWebhook(String eventType, String result) {
        registry.counter("webhook.events",
                "event_type", sanitizeTag(eventType),
                "result", sanitizeTag(result)
        ).increment();
    }

    // ==================== Generic ====================

    public void recordLatency(String operation, Duration duration) {
        registry.timer("operation.latency", "operation", sanitizeTag(operation)).record(duration);
    }

    /**
     * Registers a gauge backed by a supplier. The supplier should read a cached
     * value; it is called on every scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
