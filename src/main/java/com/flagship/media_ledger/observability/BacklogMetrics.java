package com.flagship.media_ledger.observability;

import com.flagship.media_ledger.creation.CreationRepository;
import com.flagship.media_ledger.creation.CreationStatus;
import com.flagship.media_ledger.stitch.StitchJobReconciler;
import com.flagship.media_ledger.stitch.StitchJobRepository;
import com.flagship.media_ledger.stitch.StitchJobStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for in-flight work. Values are cached and refreshed by
 * {@link MetricsScheduler} so scrapes never hit the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacklogMetrics {

    private final CreationRepository creationRepository;
    private final StitchJobRepository stitchJobRepository;
    private final StitchJobReconciler reconciler;
    private final MediaMetrics metrics;
    private final Clock clock;

    private final AtomicLong inFlightCreations = new AtomicLong();
    private final AtomicLong activeStitchJobs = new AtomicLong();
    private final AtomicLong staleStitchJobs = new AtomicLong();

    @PostConstruct
    public void init() {
        metrics.registerGauge("creation.in_flight", "Creations PENDING or PROCESSING", inFlightCreations::get);
        metrics.registerGauge("stitch.jobs.active", "Stitch jobs QUEUED or RUNNING", activeStitchJobs::get);
        metrics.registerGauge("stitch.jobs.stale",
            "Active stitch jobs past the staleness timeout", staleStitchJobs::get);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            inFlightCreations.set(creationRepository.countByStatusIn(
                List.of(CreationStatus.PENDING, CreationStatus.PROCESSING)));
            activeStitchJobs.set(stitchJobRepository.countByStatusIn(StitchJobStatus.ACTIVE));
            staleStitchJobs.set(stitchJobRepository.countByStatusInAndUpdatedAtBefore(
                StitchJobStatus.ACTIVE, clock.instant().minus(reconciler.getStaleTimeout())));
            log.debug("Backlog refreshed: creations={}, stitchActive={}, stitchStale={}",
                inFlightCreations.get(), activeStitchJobs.get(), staleStitchJobs.get());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh backlog metrics: {}", e.getMessage());
        }
    }

    public long getStaleStitchJobs() {
        return staleStitchJobs.get();
    }
}
