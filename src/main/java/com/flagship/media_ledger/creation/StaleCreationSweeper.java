package com.flagship.media_ledger.creation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StaleCreationSweeper {

    private final CreationService creationService;

    @Scheduled(fixedDelayString = "${media.creation.sweep-interval:300000}")
    public void sweep() {
        int resolved = creationService.sweepStale();
        if (resolved > 0) {
            log.info("Stale creation sweep resolved {} creations", resolved);
        }
    }
}
