package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.common.exception.AlreadyRunningException;
import com.flagship.media_ledger.common.exception.EnqueueFailureException;
import com.flagship.media_ledger.ledger.EntryType;
import com.flagship.media_ledger.ledger.LedgerEntry;
import com.flagship.media_ledger.ledger.TokenLedgerService;
import com.flagship.media_ledger.observability.MediaMetrics;
import com.flagship.media_ledger.stitch.runner.JobRunnerClient;
import com.flagship.media_ledger.stitch.runner.JobRunnerException;
import com.flagship.media_ledger.stitch.runner.StitchJobSpec;
import com.flagship.media_ledger.storage.ObjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TARGET = "target-42";
    private static final List<String> INPUTS = List.of("clips/1.mp4", "clips/2.mp4", "clips/3.mp4");

    @Mock
    private StitchJobRepository repository;
    @Mock
    private ReconciliationEngine reconciliationEngine;
    @Mock
    private JobRunnerClient runnerClient;
    @Mock
    private TokenLedgerService ledgerService;
    @Mock
    private ObjectStore objectStore;

    private JobOrchestrator orchestrator(long cost) {
        return new JobOrchestrator(repository, reconciliationEngine, runnerClient, ledgerService, objectStore,
            new TransactionTemplate(mock(PlatformTransactionManager.class)),
            new MediaMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC),
            cost, 2, "stitched", Duration.ofHours(1));
    }

    private static StitchJob existingRunning() {
        return StitchJob.create(UUID.randomUUID(), TARGET, "user-1", INPUTS, "stitched/" + TARGET + "/old.mp4",
            0, null, NOW.minus(Duration.ofHours(1))).start("Running", NOW.minus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Enqueue submits to the runner and records the execution reference")
    void enqueueSubmitsJob() {
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.empty());
        when(runnerClient.submit(any(StitchJobSpec.class))).thenReturn("exec-7");

        StitchJob job = orchestrator(0).enqueueStitch(TARGET, "user-1", INPUTS);

        assertEquals(StitchJobStatus.QUEUED, job.getStatus());
        assertEquals("exec-7", job.getExecutionRef());
        assertEquals(INPUTS, job.getInputPaths());
        assertEquals("stitched/" + TARGET + "/" + job.getId() + ".mp4", job.getOutputPath());
        verify(repository).saveAndFlush(any(StitchJobEntity.class));
        verify(repository).recordExecutionRef(job.getId(), "exec-7");
        verify(ledgerService, never()).debit(anyString(), anyLong(), anyString());
    }

    @Test
    @DisplayName("Stale active job that reconciles to FAILED does not block a new enqueue")
    void staleActiveJobIsReconciledAway() {
        StitchJob stale = existingRunning();
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.of(StitchJobEntity.fromDomain(stale)));
        when(reconciliationEngine.reconcile(any(StitchJob.class)))
            .thenReturn(stale.fail("timed out after 15 minutes without a status change", NOW));
        when(runnerClient.submit(any(StitchJobSpec.class))).thenReturn("exec-8");

        StitchJob job = orchestrator(0).enqueueStitch(TARGET, "user-1", INPUTS);

        assertNotEquals(stale.getId(), job.getId());
        assertEquals(StitchJobStatus.QUEUED, job.getStatus());
    }

    @Test
    @DisplayName("Active job that is really running rejects the enqueue")
    void activeJobRejectsEnqueue() {
        StitchJob running = existingRunning();
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.of(StitchJobEntity.fromDomain(running)));
        when(reconciliationEngine.reconcile(any(StitchJob.class))).thenReturn(running);

        AlreadyRunningException e = assertThrows(AlreadyRunningException.class,
            () -> orchestrator(0).enqueueStitch(TARGET, "user-1", INPUTS));

        assertEquals(running.getId(), e.getActiveJobId());
        verify(runnerClient, never()).submit(any());
    }

    @Test
    @DisplayName("Losing the insert race to a concurrent enqueue reports the winner")
    void concurrentEnqueueLosesOnUniqueIndex() {
        StitchJob winner = StitchJob.create(UUID.randomUUID(), TARGET, "user-2", INPUTS,
            "stitched/" + TARGET + "/w.mp4", 0, null, NOW);
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(StitchJobEntity.fromDomain(winner)));
        when(repository.saveAndFlush(any(StitchJobEntity.class)))
            .thenThrow(new DataIntegrityViolationException("uq_stitch_jobs_active_target"));

        AlreadyRunningException e = assertThrows(AlreadyRunningException.class,
            () -> orchestrator(0).enqueueStitch(TARGET, "user-1", INPUTS));

        assertEquals(winner.getId(), e.getActiveJobId());
        verify(runnerClient, never()).submit(any());
    }

    @Test
    @DisplayName("Runner rejecting the job fails it and surfaces an enqueue failure")
    void runnerRejectionFailsJob() {
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.empty());
        when(runnerClient.submit(any(StitchJobSpec.class))).thenThrow(new JobRunnerException("503 from runner"));

        assertThrows(EnqueueFailureException.class,
            () -> orchestrator(0).enqueueStitch(TARGET, "user-1", INPUTS));

        verify(reconciliationEngine).markFailed(any(StitchJob.class), startsWith("submit failed"));
        verify(repository, never()).recordExecutionRef(any(), anyString());
    }

    @Test
    @DisplayName("Configured stitch cost is debited against the job id")
    void costIsDebited() {
        when(repository.findFirstByTargetIdAndStatusInOrderByCreatedAtDesc(TARGET, StitchJobStatus.ACTIVE))
            .thenReturn(Optional.empty());
        when(ledgerService.debit(eq("user-1"), eq(4L), anyString())).thenAnswer(inv -> new LedgerEntry(
            UUID.randomUUID(), "user-1", EntryType.DEBIT, 4, inv.getArgument(2), "Charge", NOW));
        when(runnerClient.submit(any(StitchJobSpec.class))).thenReturn("exec-9");

        StitchJob job = orchestrator(4).enqueueStitch(TARGET, "user-1", INPUTS);

        verify(ledgerService).debit("user-1", 4, job.getId().toString());
        assertNotNull(job.getDebitEntryId());
        assertEquals(4, job.getCost());
    }

    @Test
    void rejectsTooFewInputs() {
        assertThrows(IllegalArgumentException.class,
            () -> orchestrator(0).enqueueStitch(TARGET, "user-1", List.of("only.mp4")));
    }

    @Test
    void rejectsBlankInput() {
        assertThrows(IllegalArgumentException.class,
            () -> orchestrator(0).enqueueStitch(TARGET, "user-1", List.of("a.mp4", " ")));
    }

    @Test
    @DisplayName("Output URL is only issued for COMPLETED jobs")
    void outputUrlOnlyWhenCompleted() {
        StitchJob running = existingRunning();
        StitchJob completed = running.complete("done", NOW);
        when(objectStore.generateTimeLimitedUrl(completed.getOutputPath(), Duration.ofHours(1)))
            .thenReturn("https://signed/url");

        assertTrue(orchestrator(0).outputUrl(running).isEmpty());
        assertEquals(Optional.of("https://signed/url"), orchestrator(0).outputUrl(completed));
    }
}
