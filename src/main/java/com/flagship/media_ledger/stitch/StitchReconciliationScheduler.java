package com.flagship.media_ledger.stitch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reconciles every non-terminal stitch job, so stale jobs are
 * failed and refunded even if nobody asks about their target.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StitchReconciliationScheduler {

    private final ReconciliationEngine reconciliationEngine;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval:60000}")
    public void reconcileActiveJobs() {
        int changed = reconciliationEngine.reconcileAll();
        if (changed > 0) {
            log.info("Reconciliation sweep updated {} stitch jobs", changed);
        }
    }
}
